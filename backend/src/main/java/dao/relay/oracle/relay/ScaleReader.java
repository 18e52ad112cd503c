package dao.relay.oracle.relay;

import dao.relay.oracle.util.CryptoUtil;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Sequential SCALE decoder over a storage value.
 */
public class ScaleReader {

    private final byte[] data;
    private int pos;

    public ScaleReader(byte[] data) {
        this.data = data;
    }

    public static ScaleReader ofHex(String hex) {
        return new ScaleReader(Numeric.hexStringToByteArray(hex));
    }

    public int readU8() {
        require(1);
        return data[pos++] & 0xFF;
    }

    public boolean readBool() {
        int b = readU8();
        if (b > 1) {
            throw new IllegalStateException("Invalid bool/option flag " + b + " at offset " + (pos - 1));
        }
        return b == 1;
    }

    public long readU32() {
        return readUnsignedLE(4).longValueExact();
    }

    public BigInteger readU64() {
        return readUnsignedLE(8);
    }

    public BigInteger readU128() {
        return readUnsignedLE(16);
    }

    public BigInteger readCompact() {
        int first = readU8();
        int mode = first & 0b11;
        switch (mode) {
            case 0:
                return BigInteger.valueOf(first >>> 2);
            case 1: {
                int second = readU8();
                return BigInteger.valueOf(((second << 8) | first) >>> 2);
            }
            case 2: {
                pos--;
                long v = readUnsignedLE(4).longValueExact();
                return BigInteger.valueOf(v >>> 2);
            }
            default: {
                int len = (first >>> 2) + 4;
                return readUnsignedLE(len);
            }
        }
    }

    public int readCompactInt() {
        return readCompact().intValueExact();
    }

    public String readAccountId() {
        require(32);
        byte[] account = Arrays.copyOfRange(data, pos, pos + 32);
        pos += 32;
        return CryptoUtil.toHex0x(account);
    }

    public void skip(int bytes) {
        require(bytes);
        pos += bytes;
    }

    public int remaining() {
        return data.length - pos;
    }

    private BigInteger readUnsignedLE(int len) {
        require(len);
        byte[] be = new byte[len];
        for (int i = 0; i < len; i++) {
            be[len - 1 - i] = data[pos + i];
        }
        pos += len;
        return new BigInteger(1, be);
    }

    private void require(int n) {
        if (pos + n > data.length) {
            throw new IllegalStateException("SCALE input exhausted: need " + n + " bytes at offset " + pos
                    + ", have " + (data.length - pos));
        }
    }
}
