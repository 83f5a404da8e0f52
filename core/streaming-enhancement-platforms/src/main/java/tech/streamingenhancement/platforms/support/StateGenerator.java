package tech.streamingenhancement.platforms.support;

import com.github.f4b6a3.tsid.TsidCreator;

import java.nio.ByteBuffer;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Generates OAuth {@code state} values and other opaque random tokens.
 *
 * <p>A state is 32 bytes rendered as unpadded base64url (43 characters). The first 8 bytes are
 * a TSID, which the TSID factory hands out strictly increasing within the process, so two
 * states issued by one process never collide. The remaining 24 bytes come from
 * {@link SecureRandom}.
 */
public final class StateGenerator {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private StateGenerator() {}

    public static String generate() {
        byte[] random = new byte[24];
        RANDOM.nextBytes(random);
        ByteBuffer buffer = ByteBuffer.allocate(32);
        buffer.putLong(TsidCreator.getTsid().toLong());
        buffer.put(random);
        return ENCODER.encodeToString(buffer.array());
    }

    /**
     * Unpadded base64url encoding of {@code byteCount} random bytes.
     */
    public static String randomToken(int byteCount) {
        byte[] bytes = new byte[byteCount];
        RANDOM.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }
}
