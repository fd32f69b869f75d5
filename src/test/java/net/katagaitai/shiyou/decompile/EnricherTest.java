package net.katagaitai.shiyou.decompile;

import com.google.common.collect.ImmutableList;
import net.katagaitai.shiyou.abi.AbiType;
import net.katagaitai.shiyou.abi.Argument;
import net.katagaitai.shiyou.abi.Method;
import net.katagaitai.shiyou.abi.ValueType;
import net.katagaitai.shiyou.evm.EnvVar;
import net.katagaitai.shiyou.spec.ABoolean;
import net.katagaitai.shiyou.spec.AInteger;
import net.katagaitai.shiyou.spec.Behaviour;
import net.katagaitai.shiyou.spec.Constructor;
import net.katagaitai.shiyou.spec.Exp;
import net.katagaitai.shiyou.spec.Interface;
import net.katagaitai.shiyou.spec.StorageItem;
import net.katagaitai.shiyou.spec.StorageUpdate;
import net.katagaitai.shiyou.spec.Time;
import net.katagaitai.shiyou.spec.TypeBounds;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.not;
import static org.junit.Assert.*;

public class EnricherTest {
    private static final StorageItem X = new StorageItem("C", "x", new ValueType.PrimitiveType(AbiType.uint(256)));
    private static final StorageItem Y = new StorageItem("C", "y", new ValueType.PrimitiveType(AbiType.uint(8)));
    private static final Exp<AInteger> V = Exp.intVar(AbiType.uint(8), "v");
    private static final Exp<AInteger> CALLER = new Exp.IntEnv(EnvVar.CALLER);

    private static Behaviour behaviour(ImmutableList<Exp<ABoolean>> preconditions) {
        Method method = new Method("f", ImmutableList.of(
                new Argument("v", AbiType.uint(8)), new Argument("b", AbiType.bool())), ImmutableList.of());
        return new Behaviour("C", "f", Interface.of(method), preconditions, ImmutableList.of(),
                ImmutableList.of(new StorageUpdate(X, new Exp.Add(new Exp.TEntry(Time.PRE, X), V))),
                CALLER);
    }

    @Test
    public void test_behaviour_bounds() {
        Exp<ABoolean> original = new Exp.LT(new Exp.TEntry(Time.PRE, Y), Exp.lit(3));
        Behaviour enriched = Enricher.enrich(behaviour(ImmutableList.of(original)));

        // existing preconditions come first and are kept
        assertEquals(original, enriched.getPreconditions().get(0));
        assertThat(enriched.getPreconditions(), hasItem(TypeBounds.bound(AbiType.uint(8), V)));
        assertThat(enriched.getPreconditions(), hasItem(TypeBounds.bound(AbiType.uint(256), new Exp.TEntry(Time.PRE, X))));
        assertThat(enriched.getPreconditions(), hasItem(TypeBounds.bound(AbiType.uint(256), new Exp.TEntry(Time.POST, X))));
        assertThat(enriched.getPreconditions(), hasItem(TypeBounds.bound(AbiType.uint(8), new Exp.TEntry(Time.PRE, Y))));
        assertThat(enriched.getPreconditions(), hasItem(TypeBounds.bound(AbiType.uint(8), new Exp.TEntry(Time.POST, Y))));
        assertThat(enriched.getPreconditions(), hasItem(TypeBounds.bound(AbiType.address(), CALLER)));
        // bools are not integers
        assertThat(enriched.getPreconditions(), not(hasItem(TypeBounds.bound(AbiType.bool(), Exp.intVar(AbiType.uint(8), "b")))));
        assertEquals(7, enriched.getPreconditions().size());
    }

    @Test
    public void test_additive() {
        Behaviour plain = behaviour(ImmutableList.of(Exp.lit(true)));
        Behaviour enriched = Enricher.enrich(plain);
        assertTrue(enriched.getPreconditions().containsAll(plain.getPreconditions()));
        assertEquals(plain.getStorageUpdates(), enriched.getStorageUpdates());
        assertEquals(plain.getReturns(), enriched.getReturns());
        assertEquals(plain.getCaseConditions(), enriched.getCaseConditions());
    }

    @Test
    public void test_idempotent() {
        Behaviour once = Enricher.enrich(behaviour(ImmutableList.of()));
        assertEquals(once, Enricher.enrich(once));

        Constructor ctor = new Constructor("C", Interface.constructor(ImmutableList.of(new Argument("v", AbiType.uint(8)))),
                ImmutableList.of(), ImmutableList.of(new StorageUpdate(X, new Exp.Mul(V, new Exp.IntEnv(EnvVar.TIMESTAMP)))));
        Constructor ctorOnce = Enricher.enrich(ctor);
        assertEquals(ctorOnce, Enricher.enrich(ctorOnce));
    }

    @Test
    public void test_constructor_bounds() {
        Constructor ctor = new Constructor("C", Interface.constructor(ImmutableList.of(new Argument("v", AbiType.uint(8)))),
                ImmutableList.of(), ImmutableList.of(new StorageUpdate(X, new Exp.IntEnv(EnvVar.CALLDEPTH))));
        Constructor enriched = Enricher.enrich(ctor);
        assertEquals(ImmutableList.of(
                TypeBounds.bound(AbiType.uint(8), V),
                TypeBounds.bound(AbiType.uint(256), new Exp.TEntry(Time.POST, X)),
                TypeBounds.bound(AbiType.uint(10), new Exp.IntEnv(EnvVar.CALLDEPTH))), enriched.getPreconditions());
    }

    @Test
    public void test_env_types() {
        assertEquals(AbiType.address(), Enricher.envType(EnvVar.ORIGIN));
        assertEquals(AbiType.bytes(32), Enricher.envType(EnvVar.BLOCKHASH));
        assertEquals(AbiType.uint(10), Enricher.envType(EnvVar.CALLDEPTH));
        for (EnvVar env : EnvVar.values()) {
            assertNotNull(env.name(), Enricher.envType(env));
        }
    }
}
