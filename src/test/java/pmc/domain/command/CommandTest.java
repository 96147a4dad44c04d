package pmc.domain.command;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pmc.common.ECommandType;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author Martin Sustik <sustik@herman.cz>
 * @since 14/10/2026
 */
class CommandTest {

    @Test
    @DisplayName("Should prefer metadata serials over the command target")
    void shouldPreferMetadataSerial() {
        // Given
        Command command = new Command("c1", "pause", Map.of("printerSerial", " SN2 ", "serial", "SN3"), "SN1", null);

        // Then
        assertThat(command.serialCandidates()).containsExactly("SN2", "SN3", "SN1");
        assertThat(command.resolveTargetSerial()).isEqualTo("SN2");
    }

    @Test
    @DisplayName("Should resolve target address from metadata first")
    void shouldResolveTargetIp() {
        assertThat(new Command("c1", "poke", Map.of("ipAddress", "10.0.0.9"), null, "10.0.0.1").resolveTargetIp())
                .isEqualTo("10.0.0.9");
        assertThat(new Command("c1", "poke", null, null, " 10.0.0.1 ").resolveTargetIp()).isEqualTo("10.0.0.1");
        assertThat(new Command("c1", "poke", null, null, null).resolveTargetIp()).isNull();
    }

    @Test
    @DisplayName("Should resolve verbs case-insensitively")
    void shouldResolveVerbs() {
        assertThat(new Command("c1", "SETSPEED", null, null, null).type()).contains(ECommandType.SET_SPEED);
        assertThat(new Command("c1", "levitate", null, null, null).type()).isEmpty();
    }

    @Test
    @DisplayName("Should read numbers from metadata strings")
    void shouldReadNumericMetadata() {
        // Given
        Command command = new Command("c1", "heat", Map.of("nozzle", "215", "bedTemp", 60), null, null);

        // Then
        assertThat(command.metadataDouble("nozzleTemp", "nozzle")).isEqualTo(215.0);
        assertThat(command.metadataDouble("bedTemp")).isEqualTo(60.0);
        assertThat(command.metadataDouble("chamber")).isNull();
    }

    @Test
    @DisplayName("Should normalize result status aliases")
    void shouldNormalizeStatus() {
        assertThat(CommandOutcome.normalizeStatus("OK")).isEqualTo(CommandOutcome.COMPLETED);
        assertThat(CommandOutcome.normalizeStatus("success")).isEqualTo(CommandOutcome.COMPLETED);
        assertThat(CommandOutcome.normalizeStatus("Error")).isEqualTo(CommandOutcome.FAILED);
        assertThat(CommandOutcome.normalizeStatus(null)).isEqualTo(CommandOutcome.FAILED);
        assertThat(CommandOutcome.normalizeStatus("Processing")).isEqualTo(CommandOutcome.PROCESSING);
    }
}
