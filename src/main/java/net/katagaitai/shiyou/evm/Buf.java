package net.katagaitai.shiyou.evm;

import lombok.EqualsAndHashCode;
import lombok.Value;
import net.katagaitai.shiyou.util.Constants;
import net.katagaitai.shiyou.util.Util;

import java.math.BigInteger;

/**
 * A byte buffer: calldata, memory slices and returned data.
 */
public abstract class Buf extends Expr {
    public static final Buf EMPTY = new ConcreteBuf(new byte[0]);

    @Override
    public Kind getKind() {
        return Kind.BUF;
    }

    /**
     * Reads the word at the given offset, resolving reads that hit a concrete write or a concrete
     * region. Everything else is left as a {@link Word.ReadWord} term.
     */
    public static Word readWord(Word offset, Buf buf) {
        if (!Word.isLit(offset)) {
            return new Word.ReadWord(offset, buf);
        }
        BigInteger off = Word.litValue(offset);
        if (buf instanceof WriteWord) {
            WriteWord write = (WriteWord) buf;
            if (!Word.isLit(write.getOffset())) {
                return new Word.ReadWord(offset, buf);
            }
            BigInteger writeOff = Word.litValue(write.getOffset());
            if (writeOff.equals(off)) {
                return write.getValue();
            }
            BigInteger distance = writeOff.subtract(off).abs();
            if (distance.compareTo(BigInteger.valueOf(Constants.WORD_BYTES)) >= 0) {
                return readWord(offset, write.getPrev());
            }
            return new Word.ReadWord(offset, buf);
        }
        if (buf instanceof ConcreteBuf) {
            byte[] bytes = ((ConcreteBuf) buf).getBytes();
            byte[] chunk = new byte[Constants.WORD_BYTES];
            if (off.compareTo(BigInteger.valueOf(bytes.length)) < 0) {
                int start = off.intValueExact();
                System.arraycopy(bytes, start, chunk, 0, Math.min(Constants.WORD_BYTES, bytes.length - start));
            }
            return Word.lit(new BigInteger(1, chunk));
        }
        return new Word.ReadWord(offset, buf);
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class ConcreteBuf extends Buf {
        byte[] bytes;

        @Override
        public String toString() {
            return "ConcreteBuf(0x" + Util.toHex(bytes) + ")";
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class AbstractBuf extends Buf {
        String name;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class WriteWord extends Buf {
        Word offset;
        Word value;
        Buf prev;
    }
}
