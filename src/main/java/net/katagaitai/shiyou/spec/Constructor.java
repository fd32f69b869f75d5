package net.katagaitai.shiyou.spec;

import com.google.common.collect.ImmutableList;
import lombok.Value;
import lombok.With;

@Value
@With
public class Constructor {
    String contract;
    Interface iface;
    ImmutableList<Exp<ABoolean>> preconditions;
    ImmutableList<StorageUpdate> initialStorage;
}
