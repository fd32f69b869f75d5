package net.katagaitai.shiyou.abi;

import com.google.common.collect.ImmutableList;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

@Value
public class Method {
    String name;
    String signature;
    Selector selector;
    ImmutableList<Argument> inputs;
    ImmutableList<Argument> outputs;

    public Method(String name, Selector selector, List<Argument> inputs, List<Argument> outputs) {
        this.name = name;
        this.inputs = ImmutableList.copyOf(inputs);
        this.outputs = ImmutableList.copyOf(outputs);
        this.signature = signature(name, inputs);
        this.selector = selector == null ? Selector.of(signature) : selector;
    }

    public Method(String name, List<Argument> inputs, List<Argument> outputs) {
        this(name, null, inputs, outputs);
    }

    public static String signature(String name, List<Argument> inputs) {
        return name + "(" + inputs.stream().map(a -> a.getType().typeName()).collect(Collectors.joining(",")) + ")";
    }
}
