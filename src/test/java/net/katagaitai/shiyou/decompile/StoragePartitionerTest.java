package net.katagaitai.shiyou.decompile;

import com.google.common.collect.ImmutableMap;
import net.katagaitai.shiyou.TestUtil;
import net.katagaitai.shiyou.evm.Store;
import net.katagaitai.shiyou.evm.Word;
import org.junit.Test;

import java.math.BigInteger;

import static org.junit.Assert.*;

public class StoragePartitionerTest {

    @Test
    public void test_last_write_wins() throws UnsupportedException {
        Store store = new Store.SStore(Word.lit(0), Word.var("c"),
                new Store.SStore(Word.lit(1), Word.var("b"),
                        new Store.SStore(Word.lit(0), Word.var("a"), TestUtil.PRE)));
        DistinctStore result = StoragePartitioner.partition(store);
        assertEquals(2, result.getWrites().size());
        assertEquals(Word.var("c"), result.getWrites().get(BigInteger.ZERO));
        assertEquals(Word.var("b"), result.getWrites().get(BigInteger.ONE));
        assertFalse(result.isConcreteBase());
    }

    @Test
    public void test_untouched_storage() throws UnsupportedException {
        DistinctStore result = StoragePartitioner.partition(TestUtil.PRE);
        assertTrue(result.getWrites().isEmpty());
        assertFalse(result.isConcreteBase());
    }

    @Test
    public void test_concrete_base_is_merged_under_writes() throws UnsupportedException {
        Store base = new Store.ConcreteStore(ImmutableMap.of(BigInteger.ZERO, BigInteger.TEN, BigInteger.valueOf(2), BigInteger.ONE));
        DistinctStore result = StoragePartitioner.partition(new Store.SStore(Word.lit(0), Word.var("v"), base));
        assertTrue(result.isConcreteBase());
        assertEquals(Word.var("v"), result.getWrites().get(BigInteger.ZERO));
        assertEquals(Word.lit(1), result.getWrites().get(BigInteger.valueOf(2)));
    }

    @Test
    public void test_symbolic_key() {
        Store store = new Store.SStore(Word.lit(0), Word.lit(1), new Store.SStore(Word.var("k"), Word.lit(1), TestUtil.PRE));
        try {
            StoragePartitioner.partition(store);
            fail();
        } catch (UnsupportedException e) {
            assertTrue(e.getMessage().contains("symbolic storage slots"));
        }
    }
}
