package net.katagaitai.shiyou.decompile;

import com.google.common.collect.ImmutableList;
import lombok.Getter;

import java.util.List;

@Getter
public class PartialExplorationException extends UnsupportedException {
    private final String entryPoint;
    private final ImmutableList<String> descriptions;

    public PartialExplorationException(String entryPoint, List<String> descriptions) {
        super("partially explored branches in " + entryPoint + ":\n" + String.join("\n", descriptions));
        this.entryPoint = entryPoint;
        this.descriptions = ImmutableList.copyOf(descriptions);
    }
}
