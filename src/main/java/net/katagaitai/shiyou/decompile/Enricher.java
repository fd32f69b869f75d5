package net.katagaitai.shiyou.decompile;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import net.katagaitai.shiyou.abi.AbiType;
import net.katagaitai.shiyou.abi.ValueType;
import net.katagaitai.shiyou.evm.EnvVar;
import net.katagaitai.shiyou.spec.ABoolean;
import net.katagaitai.shiyou.spec.Behaviour;
import net.katagaitai.shiyou.spec.Constructor;
import net.katagaitai.shiyou.spec.Contract;
import net.katagaitai.shiyou.spec.Decl;
import net.katagaitai.shiyou.spec.Exp;
import net.katagaitai.shiyou.spec.SType;
import net.katagaitai.shiyou.spec.Specification;
import net.katagaitai.shiyou.spec.StorageItem;
import net.katagaitai.shiyou.spec.StorageUpdate;
import net.katagaitai.shiyou.spec.Time;
import net.katagaitai.shiyou.spec.TypeBounds;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Adds the range facts implied by the types of calldata, environment values and storage as
 * preconditions. Existing preconditions are kept in place and facts already present are not
 * added again, so enriching twice is the same as enriching once.
 */
public class Enricher {
    private static final ImmutableMap<EnvVar, AbiType> ENV_TYPES = ImmutableMap.<EnvVar, AbiType>builder()
            .put(EnvVar.CALLER, AbiType.address())
            .put(EnvVar.CALLVALUE, AbiType.uint(256))
            .put(EnvVar.CALLDEPTH, AbiType.uint(10))
            .put(EnvVar.ORIGIN, AbiType.address())
            .put(EnvVar.BLOCKHASH, AbiType.bytes(32))
            .put(EnvVar.BLOCKNUMBER, AbiType.uint(256))
            .put(EnvVar.DIFFICULTY, AbiType.uint(256))
            .put(EnvVar.CHAINID, AbiType.uint(256))
            .put(EnvVar.GASLIMIT, AbiType.uint(256))
            .put(EnvVar.COINBASE, AbiType.address())
            .put(EnvVar.TIMESTAMP, AbiType.uint(256))
            .put(EnvVar.THIS, AbiType.address())
            .put(EnvVar.NONCE, AbiType.uint(256))
            .build();

    public static AbiType envType(EnvVar env) {
        return ENV_TYPES.get(env);
    }

    public static Specification enrich(Specification spec) {
        Contract contract = spec.getContract();
        List<Behaviour> behaviours = Lists.newArrayList();
        for (Behaviour behaviour : contract.getBehaviours()) {
            behaviours.add(enrich(behaviour));
        }
        return spec.withContract(contract
                .withConstructor(enrich(contract.getConstructor()))
                .withBehaviours(ImmutableList.copyOf(behaviours)));
    }

    public static Constructor enrich(Constructor ctor) {
        Set<Exp<ABoolean>> pre = new LinkedHashSet<>(ctor.getPreconditions());
        pre.addAll(callDataBounds(ctor.getIface().getDecls()));
        pre.addAll(storageBounds(ctor.getInitialStorage(), Time.POST));
        List<Exp<?>> exps = Lists.newArrayList(ctor.getPreconditions());
        for (StorageUpdate update : ctor.getInitialStorage()) {
            exps.add(update.getValue());
        }
        pre.addAll(envBounds(exps));
        return ctor.withPreconditions(ImmutableList.copyOf(pre));
    }

    public static Behaviour enrich(Behaviour behaviour) {
        Set<Exp<ABoolean>> pre = new LinkedHashSet<>(behaviour.getPreconditions());
        pre.addAll(callDataBounds(behaviour.getIface().getDecls()));
        pre.addAll(storageBounds(behaviour.getStorageUpdates(), Time.PRE, Time.POST));
        List<Exp<?>> conditions = Lists.newArrayList();
        conditions.addAll(behaviour.getPreconditions());
        conditions.addAll(behaviour.getCaseConditions());
        pre.addAll(locationBounds(conditions, Time.PRE, Time.POST));
        List<Exp<?>> exps = Lists.newArrayList(conditions);
        for (StorageUpdate update : behaviour.getStorageUpdates()) {
            exps.add(update.getValue());
        }
        if (behaviour.hasReturns()) {
            exps.add(behaviour.getReturns());
        }
        pre.addAll(envBounds(exps));
        return behaviour.withPreconditions(ImmutableList.copyOf(pre));
    }

    static List<Exp<ABoolean>> callDataBounds(List<Decl> decls) {
        List<Exp<ABoolean>> result = Lists.newArrayList();
        for (Decl decl : decls) {
            if (SType.of(decl.getType()) == SType.Tag.INTEGER) {
                result.add(TypeBounds.bound(decl.getType(), Exp.intVar(decl.getType(), decl.getName())));
            }
        }
        return result;
    }

    static List<Exp<ABoolean>> storageBounds(List<StorageUpdate> updates, Time... times) {
        List<Exp<ABoolean>> result = Lists.newArrayList();
        for (StorageUpdate update : updates) {
            result.addAll(itemBounds(update.getItem(), times));
        }
        return result;
    }

    static List<Exp<ABoolean>> locationBounds(Collection<Exp<?>> exps, Time... times) {
        Set<StorageItem> items = new LinkedHashSet<>();
        for (Exp<?> e : exps) {
            collect(e, items, Sets.newLinkedHashSet());
        }
        List<Exp<ABoolean>> result = Lists.newArrayList();
        for (StorageItem item : items) {
            result.addAll(itemBounds(item, times));
        }
        return result;
    }

    static List<Exp<ABoolean>> envBounds(Collection<Exp<?>> exps) {
        Set<EnvVar> envs = new LinkedHashSet<>();
        for (Exp<?> e : exps) {
            collect(e, Sets.newLinkedHashSet(), envs);
        }
        List<Exp<ABoolean>> result = Lists.newArrayList();
        for (EnvVar env : envs) {
            result.add(TypeBounds.bound(ENV_TYPES.get(env), new Exp.IntEnv(env)));
        }
        return result;
    }

    private static List<Exp<ABoolean>> itemBounds(StorageItem item, Time... times) {
        List<Exp<ABoolean>> result = Lists.newArrayList();
        if (!(item.getType() instanceof ValueType.PrimitiveType)) {
            return result;
        }
        AbiType type = ((ValueType.PrimitiveType) item.getType()).getType();
        for (Time time : times) {
            result.add(TypeBounds.bound(type, new Exp.TEntry(time, item)));
        }
        return result;
    }

    /**
     * Collects the storage items and environment values an expression refers to.
     */
    private static void collect(Exp<?> e, Set<StorageItem> items, Set<EnvVar> envs) {
        if (e instanceof Exp.TEntry) {
            items.add(((Exp.TEntry) e).getItem());
        } else if (e instanceof Exp.IntEnv) {
            envs.add(((Exp.IntEnv) e).getEnv());
        } else if (e instanceof Exp.IntBinOp) {
            collect(((Exp.IntBinOp) e).getA(), items, envs);
            collect(((Exp.IntBinOp) e).getB(), items, envs);
        } else if (e instanceof Exp.Comparison) {
            collect(((Exp.Comparison) e).getA(), items, envs);
            collect(((Exp.Comparison) e).getB(), items, envs);
        } else if (e instanceof Exp.BoolBinOp) {
            collect(((Exp.BoolBinOp) e).getA(), items, envs);
            collect(((Exp.BoolBinOp) e).getB(), items, envs);
        } else if (e instanceof Exp.Neg) {
            collect(((Exp.Neg) e).getA(), items, envs);
        } else if (e instanceof Exp.InRange) {
            collect(((Exp.InRange) e).getE(), items, envs);
        } else if (e instanceof Exp.Eq) {
            collect(((Exp.Eq<?>) e).getA(), items, envs);
            collect(((Exp.Eq<?>) e).getB(), items, envs);
        } else if (e instanceof Exp.NEq) {
            collect(((Exp.NEq<?>) e).getA(), items, envs);
            collect(((Exp.NEq<?>) e).getB(), items, envs);
        } else if (e instanceof Exp.ITE) {
            collect(((Exp.ITE<?>) e).getCondition(), items, envs);
            collect(((Exp.ITE<?>) e).getA(), items, envs);
            collect(((Exp.ITE<?>) e).getB(), items, envs);
        }
    }
}
