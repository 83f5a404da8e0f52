package tech.streamingenhancement.platforms.support;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class StateGeneratorTest {

    @Test
    void shouldGenerateUrlSafe32ByteStates() {
        String state = StateGenerator.generate();

        assertEquals(43, state.length(), "32 bytes encode to 43 unpadded base64url characters");
        assertThat(state).matches("[A-Za-z0-9_-]+");
    }

    @Test
    void shouldNeverRepeatWithinProcess() {
        Set<String> states = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            states.add(StateGenerator.generate());
        }

        assertEquals(10_000, states.size());
    }

    @Test
    void shouldEncodeRandomTokensWithoutPadding() {
        assertEquals(64, StateGenerator.randomToken(48).length());
    }
}
