package net.katagaitai.shiyou.evm;

import lombok.Value;
import net.katagaitai.shiyou.util.Constants;

@Value
public class Address {
    public static final Address ENTRYPOINT = new Address(Constants.ENTRYPOINT_ADDRESS);

    String name;

    @Override
    public String toString() {
        return name;
    }
}
