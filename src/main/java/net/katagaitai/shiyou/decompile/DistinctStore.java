package net.katagaitai.shiyou.decompile;

import com.google.common.collect.ImmutableSortedMap;
import lombok.Value;
import net.katagaitai.shiyou.evm.Word;

import java.math.BigInteger;

/**
 * Final storage as a map from provably distinct concrete slots to their values. Slots that are
 * absent keep their pre-state value, which is zero when the base is concrete.
 */
@Value
public class DistinctStore {
    ImmutableSortedMap<BigInteger, Word> writes;
    boolean concreteBase;
}
