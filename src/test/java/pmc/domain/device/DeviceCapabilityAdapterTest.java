package pmc.domain.device;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author Martin Sustik <sustik@herman.cz>
 * @since 13/10/2026
 */
class DeviceCapabilityAdapterTest {

    @Test
    @DisplayName("Should use the first supported variant")
    void shouldUseFirstSupportedVariant() {
        // Given
        FakeDevice device = new FakeDevice("SN1").answer("get_print_state", "RUNNING");
        DeviceCapabilityAdapter adapter = new DeviceCapabilityAdapter(device);

        // When
        InvocationOutcome outcome = adapter.invokeFirst(DeviceMethods.STATE);

        // Then
        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.method()).isEqualTo("get_print_state");
        assertThat(outcome.value()).isEqualTo("RUNNING");
    }

    @Test
    @DisplayName("Should fall through to the next variant when one fails")
    void shouldFallThroughFailingVariant() {
        // Given
        FakeDevice device = new FakeDevice("SN1")
                .fail("pause_print", new IOException("socket closed"))
                .answer("pause", true);
        DeviceCapabilityAdapter adapter = new DeviceCapabilityAdapter(device);

        // When
        InvocationOutcome outcome = adapter.invokeFirst(DeviceMethods.PAUSE);

        // Then
        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.method()).isEqualTo("pause");
        assertThat(device.invokedMethods()).containsExactly("pause_print", "pause");
    }

    @Test
    @DisplayName("Should report the last error when every variant fails")
    void shouldReportLastError() {
        // Given
        FakeDevice device = new FakeDevice("SN1")
                .fail("stop_print", new IOException("first"))
                .fail("stop", new IllegalStateException("second"));
        DeviceCapabilityAdapter adapter = new DeviceCapabilityAdapter(device);

        // When
        InvocationOutcome outcome = adapter.invokeFirst(DeviceMethods.STOP);

        // Then
        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.lastError()).isEqualTo("second");
    }

    @Test
    @DisplayName("Should never invoke verbs the driver does not expose")
    void shouldSkipUnsupportedVerbs() {
        // Given
        FakeDevice device = new FakeDevice("SN1");
        DeviceCapabilityAdapter adapter = new DeviceCapabilityAdapter(device);

        // When
        Object value = adapter.query(List.of("get_state", "get_print_state"));

        // Then
        assertThat(value).isNull();
        assertThat(device.invokedMethods()).isEmpty();
        assertThat(adapter.supportsAny(DeviceMethods.GCODE)).isFalse();
    }

    @Test
    @DisplayName("Should send raw gcode through the gcode verb")
    void shouldSendGcode() {
        // Given
        FakeDevice device = new FakeDevice("SN1").support("send_gcode");
        DeviceCapabilityAdapter adapter = new DeviceCapabilityAdapter(device);

        // When
        InvocationOutcome outcome = adapter.sendGcode("G28");

        // Then
        assertThat(outcome.succeeded()).isTrue();
        assertThat(device.callsTo("send_gcode").get(0).args()).containsExactly("G28");
    }
}
