package org.automatakit.automata.exceptions;

/**
 * 引擎错误的种类，供外部协作方（界面、持久化层）据此呈现错误信息。
 */
public enum ErrorKind {
    INVALID_REFERENCE,   // 引用了自动机中不存在的状态或符号
    DUPLICATE_STATE,     // 状态标识重复
    PRECONDITION,        // 输入不满足确定性/完全性/可达性前置条件
    EMPTY_AUTOMATON,     // 需要初始状态但不存在
    LIMIT_EXCEEDED,      // 超出配置的资源上限
    CANCELLED,           // 调用方取消了操作
    MALFORMED_DEFINITION // 结构化定义（JSON）无法解析或不合法
}
