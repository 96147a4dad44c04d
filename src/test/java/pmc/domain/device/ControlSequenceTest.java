package pmc.domain.device;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author Martin Sustik <sustik@herman.cz>
 * @since 13/10/2026
 */
class ControlSequenceTest {

    @Test
    @DisplayName("Should roll over after 9999")
    void shouldRollOver() {
        // Given
        ControlSequence sequence = new ControlSequence();
        for (int i = 1; i < 9999; i++) {
            sequence.next();
        }

        // When
        String last = sequence.next();
        String wrapped = sequence.next();

        // Then
        assertThat(last).isEqualTo("9999");
        assertThat(wrapped).isEqualTo("1");
    }
}
