package net.katagaitai.shiyou.artifact;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.shiyou.abi.AbiType;
import net.katagaitai.shiyou.abi.Argument;
import net.katagaitai.shiyou.abi.Method;
import net.katagaitai.shiyou.abi.Selector;
import net.katagaitai.shiyou.abi.SlotType;
import net.katagaitai.shiyou.abi.StorageLayoutItem;
import net.katagaitai.shiyou.abi.ValueType;
import net.katagaitai.shiyou.util.Util;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads compiled contracts from the output of {@code solc --combined-json
 * abi,bin,bin-runtime,storage-layout,hashes} or from a foundry artifact.
 */
@Slf4j(topic = "shiyou")
public class BuildOutputReader {
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Reads every contract of a build output file. A foundry artifact holds a single contract,
     * named after the file.
     */
    public ImmutableMap<String, SolcContract> read(Path path) throws IOException {
        String json = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        JsonNode root = mapper.readTree(json);
        if (root.has("contracts")) {
            return readCombinedJson(root);
        }
        String name = StringUtils.substringBefore(path.getFileName().toString(), ".");
        return ImmutableMap.of(name, readFoundryArtifact(name, root));
    }

    public ImmutableMap<String, SolcContract> readCombinedJson(String json) throws IOException {
        return readCombinedJson(mapper.readTree(json));
    }

    public SolcContract readFoundryArtifact(String name, String json) throws IOException {
        return readFoundryArtifact(name, mapper.readTree(json));
    }

    private ImmutableMap<String, SolcContract> readCombinedJson(JsonNode root) throws IOException {
        ImmutableMap.Builder<String, SolcContract> result = ImmutableMap.builder();
        Iterator<Map.Entry<String, JsonNode>> it = root.get("contracts").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode c = entry.getValue();
            log.debug("read contract: {}", entry.getKey());
            result.put(entry.getKey(), build(
                    entry.getKey(),
                    embedded(c.get("abi")),
                    text(c, "bin"),
                    text(c, "bin-runtime"),
                    embedded(c.get("storage-layout")),
                    c.get("hashes")));
        }
        return result.build();
    }

    private SolcContract readFoundryArtifact(String name, JsonNode root) {
        return build(
                name,
                root.get("abi"),
                root.path("bytecode").path("object").asText(""),
                root.path("deployedBytecode").path("object").asText(""),
                root.get("storageLayout"),
                root.get("methodIdentifiers"));
    }

    // older solc releases embed the abi and the layout as json strings
    private JsonNode embedded(JsonNode node) throws IOException {
        if (node != null && node.isTextual()) {
            return mapper.readTree(node.asText());
        }
        return node;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null ? "" : value.asText();
    }

    private static SolcContract build(String name, JsonNode abi, String bin, String binRuntime, JsonNode layout,
                                      JsonNode hashes) {
        List<Argument> constructorInputs = Lists.newArrayList();
        List<Method> methods = Lists.newArrayList();
        if (abi != null) {
            for (JsonNode entry : abi) {
                String type = entry.path("type").asText("function");
                if (type.equals("constructor")) {
                    constructorInputs.addAll(arguments(entry.get("inputs")));
                } else if (type.equals("function")) {
                    methods.add(method(entry, hashes));
                }
            }
        }
        return SolcContract.builder()
                .name(name)
                .creationCode(Util.fromHex(bin))
                .runtimeCode(Util.fromHex(binRuntime))
                .constructorInputs(ImmutableList.copyOf(constructorInputs))
                .methods(ImmutableList.copyOf(methods))
                .storageLayout(layout == null || layout.isNull() ? null : storageLayout(layout))
                .build();
    }

    private static Method method(JsonNode entry, JsonNode hashes) {
        String name = entry.get("name").asText();
        List<Argument> inputs = arguments(entry.get("inputs"));
        String signature = Method.signature(name, inputs);
        Selector selector = null;
        if (hashes != null && hashes.has(signature)) {
            selector = new Selector(hashes.get(signature).asText());
        }
        // falls back to the keccak hash of the signature
        return new Method(name, selector, inputs, arguments(entry.get("outputs")));
    }

    private static List<Argument> arguments(JsonNode node) {
        List<Argument> result = Lists.newArrayList();
        if (node == null) {
            return result;
        }
        for (JsonNode argument : node) {
            result.add(new Argument(argument.path("name").asText(""), abiType(argument)));
        }
        return result;
    }

    private static AbiType abiType(JsonNode argument) {
        String type = argument.get("type").asText();
        if (!type.startsWith("tuple")) {
            return AbiType.parse(type);
        }
        List<AbiType> components = Lists.newArrayList();
        for (JsonNode component : argument.get("components")) {
            components.add(abiType(component));
        }
        AbiType tuple = new AbiType.Tuple(components);
        // tuple[], tuple[2][] ...
        String suffix = type.substring("tuple".length());
        while (!suffix.isEmpty()) {
            int close = suffix.indexOf(']');
            String len = suffix.substring(1, close);
            tuple = len.isEmpty() ? new AbiType.DynamicArray(tuple) : new AbiType.FixedArray(Integer.parseInt(len), tuple);
            suffix = suffix.substring(close + 1);
        }
        return tuple;
    }

    private static ImmutableMap<String, StorageLayoutItem> storageLayout(JsonNode layout) {
        JsonNode types = layout.path("types");
        Map<String, StorageLayoutItem> result = Maps.newLinkedHashMap();
        for (JsonNode item : layout.path("storage")) {
            String label = item.get("label").asText();
            result.put(label, new StorageLayoutItem(
                    label,
                    new BigInteger(item.get("slot").asText()),
                    item.path("offset").asInt(0),
                    slotType(types, item.get("type").asText())));
        }
        return ImmutableMap.copyOf(result);
    }

    private static SlotType slotType(JsonNode types, String id) {
        JsonNode type = types.get(id);
        if (type == null || !type.path("encoding").asText().equals("mapping")) {
            return new SlotType.StorageValue(valueType(types, id));
        }
        List<ValueType> keys = Lists.newArrayList();
        while (type.path("encoding").asText().equals("mapping")) {
            keys.add(valueType(types, type.get("key").asText()));
            id = type.get("value").asText();
            type = types.get(id);
        }
        return new SlotType.StorageMapping(keys, valueType(types, id));
    }

    private static ValueType valueType(JsonNode types, String id) {
        JsonNode type = types.get(id);
        if (type == null) {
            throw new IllegalArgumentException("unknown storage type: " + id);
        }
        String label = type.get("label").asText();
        if (label.startsWith("contract ")) {
            return new ValueType.ContractType(StringUtils.substringAfter(label, "contract "));
        }
        return new ValueType.PrimitiveType(storageAbiType(types, type));
    }

    private static AbiType storageAbiType(JsonNode types, JsonNode type) {
        String label = type.get("label").asText();
        String encoding = type.path("encoding").asText();
        if (type.has("members")) {
            List<AbiType> members = Lists.newArrayList();
            for (JsonNode member : type.get("members")) {
                members.add(storageAbiType(types, types.get(member.get("type").asText())));
            }
            return new AbiType.Tuple(members);
        }
        if (type.has("base")) {
            AbiType base = storageAbiType(types, types.get(type.get("base").asText()));
            if (encoding.equals("dynamic_array")) {
                return new AbiType.DynamicArray(base);
            }
            String len = StringUtils.substringBefore(StringUtils.substringAfterLast(label, "["), "]");
            return new AbiType.FixedArray(Integer.parseInt(len), base);
        }
        if (label.startsWith("enum ")) {
            return AbiType.uint(8 * Integer.parseInt(type.path("numberOfBytes").asText("1")));
        }
        if (label.startsWith("function ")) {
            return new AbiType.Function();
        }
        if (label.startsWith("contract ") || label.startsWith("address")) {
            return AbiType.address();
        }
        if (encoding.equals("bytes")) {
            return label.equals("string") ? new AbiType.StringType() : new AbiType.Bytes();
        }
        return AbiType.parse(label);
    }
}
