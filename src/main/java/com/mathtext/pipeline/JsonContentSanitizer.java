package com.mathtext.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.mathtext.placeholder.PlaceholderCleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * 在接口响应进入分段器前清理其中的泄漏占位符。
 *
 * fieldNames 为空时清理所有字符串；否则只清理这些字段（含其嵌套内容）下的字符串。
 */
public class JsonContentSanitizer {
    private static final Logger logger = LoggerFactory.getLogger(JsonContentSanitizer.class);

    private final PlaceholderCleaner cleaner;
    private final Set<String> fieldNames;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public JsonContentSanitizer(PlaceholderCleaner cleaner) {
        this(cleaner, Set.of());
    }

    public JsonContentSanitizer(PlaceholderCleaner cleaner, Set<String> fieldNames) {
        this.cleaner = cleaner;
        this.fieldNames = fieldNames == null ? Set.of() : Set.copyOf(fieldNames);
    }

    /**
     * 返回清理后的深拷贝，原节点不被修改。
     */
    public JsonNode sanitize(JsonNode root) {
        if (root == null) {
            return NullNode.getInstance();
        }
        if (!root.isContainerNode()) {
            logger.warn("JSON 根节点不是对象或数组: {}", root.getNodeType());
        }
        return sanitizeNode(root, fieldNames.isEmpty());
    }

    /**
     * 解析、清理并重新序列化 JSON 文本。
     */
    public String sanitize(String json) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(json);
        return objectMapper.writeValueAsString(sanitize(root));
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    private JsonNode sanitizeNode(JsonNode node, boolean inScope) {
        if (node.isTextual()) {
            return inScope ? TextNode.valueOf(cleaner.clean(node.textValue())) : node;
        }
        if (node.isObject()) {
            ObjectNode copy = objectMapper.createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                boolean childScope = inScope || fieldNames.contains(field.getKey());
                copy.set(field.getKey(), sanitizeNode(field.getValue(), childScope));
            }
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = objectMapper.createArrayNode();
            for (JsonNode element : node) {
                copy.add(sanitizeNode(element, inScope));
            }
            return copy;
        }
        return node.deepCopy();
    }
}
