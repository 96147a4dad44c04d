package pmc.dal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pmc.common.EConnectionType;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for ConfigurationService
 * @author Martin Sustik <sustik@herman.cz>
 * @since 12/10/2026
 */
class ConfigurationServiceTest {

    private static ConfigurationService serviceFor(Properties props) throws ConfigurationException {
        return new ConfigurationService(new ConfigurationLoader(props));
    }

    private static Properties baseProperties() {
        Properties props = new Properties();
        props.setProperty("cloud.enabled", "true");
        props.setProperty("cloud.base.url", "https://cloud.example.com/");
        props.setProperty("cloud.recipient.id", "recipient-1");
        props.setProperty("printers.count", "2");
        props.setProperty("printers.1.serial", "SN1");
        props.setProperty("printers.1.connection", "LAN");
        props.setProperty("printers.1.ip", "192.168.1.10");
        props.setProperty("printers.1.access.code", "12345678");
        props.setProperty("printers.2.serial", "SN2");
        props.setProperty("printers.2.connection", "NONE");
        return props;
    }

    @Test
    @DisplayName("Should load printers in configured order")
    void shouldLoadPrintersInOrder() throws ConfigurationException {
        // When
        ConfigurationService service = serviceFor(baseProperties());

        // Then
        assertThat(service.getPrinterConfigurations()).hasSize(2);
        PrinterConfig first = service.getPrinterConfigurations().get(0);
        assertThat(first.serialNumber()).isEqualTo("SN1");
        assertThat(first.connectionType()).isEqualTo(EConnectionType.LAN);
        assertThat(first.ipAddress()).isEqualTo("192.168.1.10");
        assertThat(service.getPrinterConfigurations().get(1).isSimulated()).isTrue();
    }

    @Test
    @DisplayName("Should reject duplicate printer serials")
    void shouldRejectDuplicateSerials() {
        // Given
        Properties props = baseProperties();
        props.setProperty("printers.2.serial", "SN1");

        // When & Then
        assertThatThrownBy(() -> serviceFor(props))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Duplicate printer serial");
    }

    @Test
    @DisplayName("Should reject LAN printer without access code")
    void shouldRejectLanPrinterWithoutAccessCode() {
        // Given
        Properties props = baseProperties();
        props.remove("printers.1.access.code");

        // When & Then
        assertThatThrownBy(() -> serviceFor(props))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Access code cannot be empty");
    }

    @Test
    @DisplayName("Should clamp control poll interval to minimum")
    void shouldClampControlPollInterval() throws ConfigurationException {
        // Given
        Properties props = baseProperties();
        props.setProperty("control.poll.sec", "1");

        // When
        CloudConfig cloud = serviceFor(props).getCloudConfiguration();

        // Then
        assertThat(cloud.controlPollSec()).isEqualTo(3);
        assertThat(cloud.normalizedBaseUrl()).isEqualTo("https://cloud.example.com");
    }

    @Test
    @DisplayName("Should require recipient id when cloud is enabled")
    void shouldRequireRecipientId() {
        // Given
        Properties props = baseProperties();
        props.remove("cloud.recipient.id");

        // When & Then
        assertThatThrownBy(() -> serviceFor(props))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("cloud.recipient.id");
    }

    @Test
    @DisplayName("Should not validate cloud settings when cloud is disabled")
    void shouldSkipCloudValidationWhenDisabled() throws ConfigurationException {
        // Given
        Properties props = baseProperties();
        props.setProperty("cloud.enabled", "false");
        props.setProperty("cloud.base.url", "not-a-url");
        props.remove("cloud.recipient.id");

        // When
        CloudConfig cloud = serviceFor(props).getCloudConfiguration();

        // Then
        assertThat(cloud.enabled()).isFalse();
    }

    @Test
    @DisplayName("Should fall back to LENIENT for unknown startup mode")
    void shouldFallBackToLenientStartupMode() throws ConfigurationException {
        // Given
        Properties props = baseProperties();
        props.setProperty("server.startup.mode", "whatever");

        // When
        ServerConfig server = serviceFor(props).getServerConfiguration();

        // Then
        assertThat(server.startupMode()).isEqualTo(StartupMode.LENIENT);
        assertThat(server.port()).isEqualTo(7070);
    }

    @Test
    @DisplayName("Should load telemetry tuning with defaults")
    void shouldLoadMonitorDefaults() throws ConfigurationException {
        // When
        MonitorConfig monitor = serviceFor(baseProperties()).getMonitorConfiguration();

        // Then
        assertThat(monitor.stallHeartbeats()).isEqualTo(3);
        assertThat(monitor.completionDebounce()).isEqualTo(1);
        assertThat(monitor.heartbeatMs()).isEqualTo(5000L);
        assertThat(monitor.startAckTimeoutSec()).isEqualTo(60);
    }

    @Test
    @DisplayName("Should parse reactivation command list")
    void shouldParseReactivationCommands() throws ConfigurationException {
        // Given
        Properties props = baseProperties();
        props.setProperty("transfer.reactivate.commands", "ENABLE_STOR, , SITE REACTIVATE");

        // When
        TransferConfig transfer = serviceFor(props).getTransferConfiguration();

        // Then
        assertThat(transfer.reactivateCommands()).containsExactly("ENABLE_STOR", "SITE REACTIVATE");
    }
}
