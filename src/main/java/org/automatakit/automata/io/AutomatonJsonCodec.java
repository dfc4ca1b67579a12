package org.automatakit.automata.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.automatakit.automata.exceptions.AutomatonException;
import org.automatakit.automata.exceptions.MalformedDefinitionException;
import org.automatakit.automata.models.Automaton;
import org.automatakit.automata.models.AutomatonSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * 自动机与其 JSON 快照之间的编解码。
 * 只处理字符串与调用方传入的流，文件的读写由外部协作方负责。
 */
public final class AutomatonJsonCodec {

    private static final Logger logger = LoggerFactory.getLogger(AutomatonJsonCodec.class);

    private final ObjectMapper mapper;

    public AutomatonJsonCodec() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(Automaton automaton) {
        try {
            return mapper.writeValueAsString(automaton.toSnapshot());
        } catch (JsonProcessingException e) {
            logger.error("序列化自动机 {} 失败", automaton.getName(), e);
            throw new MalformedDefinitionException("无法序列化自动机 '" + automaton.getName() + "'", e);
        }
    }

    /**
     * 由 JSON 文本重建自动机。
     * @throws MalformedDefinitionException JSON 不合法，或定义引用了不存在的状态/符号。
     */
    public Automaton fromJson(String json) {
        AutomatonSnapshot snapshot;
        try {
            snapshot = mapper.readValue(json, AutomatonSnapshot.class);
        } catch (JsonProcessingException e) {
            logger.error("解析自动机 JSON 失败: {}", e.getOriginalMessage());
            throw new MalformedDefinitionException("无法解析自动机 JSON: " + e.getOriginalMessage(), e);
        }
        return build(snapshot);
    }

    public Automaton fromJson(InputStream in) {
        AutomatonSnapshot snapshot;
        try {
            snapshot = mapper.readValue(in, AutomatonSnapshot.class);
        } catch (IOException e) {
            logger.error("读取自动机 JSON 失败: {}", e.getMessage());
            throw new MalformedDefinitionException("无法读取自动机 JSON: " + e.getMessage(), e);
        }
        return build(snapshot);
    }

    private Automaton build(AutomatonSnapshot snapshot) {
        if (snapshot == null) {
            throw new MalformedDefinitionException("自动机 JSON 为空");
        }
        if (snapshot.getAlphabet() != null && snapshot.getAlphabet().stream().anyMatch(label -> label == null)) {
            throw new MalformedDefinitionException("自动机定义 '" + snapshot.getName() + "' 的字母表中存在空符号");
        }
        if (snapshot.getStates() != null
                && snapshot.getStates().stream().anyMatch(s -> s == null || s.getId() == null)) {
            throw new MalformedDefinitionException("自动机定义 '" + snapshot.getName() + "' 中存在缺少 id 的状态");
        }
        if (snapshot.getTransitions() != null
                && snapshot.getTransitions().stream().anyMatch(t -> t == null || t.getFrom() == null || t.getTo() == null)) {
            throw new MalformedDefinitionException("自动机定义 '" + snapshot.getName() + "' 中存在缺少端点的迁移");
        }
        // epsilon 迁移必须显式写作 "ε"，缺少符号不能被当作 epsilon
        if (snapshot.getTransitions() != null
                && snapshot.getTransitions().stream().anyMatch(t -> t.getSymbol() == null)) {
            throw new MalformedDefinitionException("自动机定义 '" + snapshot.getName() + "' 中存在缺少符号的迁移");
        }
        try {
            Automaton automaton = Automaton.fromSnapshot(snapshot);
            logger.info("由 JSON 重建了 {}", automaton);
            return automaton;
        } catch (AutomatonException e) {
            logger.error("自动机定义 {} 不合法: {}", snapshot.getName(), e.getMessage());
            throw new MalformedDefinitionException("自动机定义 '" + snapshot.getName() + "' 不合法: " + e.getMessage(), e);
        }
    }
}
