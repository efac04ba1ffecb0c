package config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ServerConfigTest {

    @Test
    void shouldUseDefaults() {
        ServerConfig config = new ServerConfig();

        assertThat(config.getHost()).isEqualTo("127.0.0.1");
        assertThat(config.getPort()).isEqualTo(6379);
        assertThat(config.getConnectionMode()).isEqualTo(ConnectionMode.CONCURRENT);
        assertThat(config.isSweepEnabled()).isTrue();
    }

    @Test
    void shouldOverrideFromCommandLine() {
        // given
        ServerConfig config = new ServerConfig();

        // when
        config.parseCommandLineArgs(new String[]{
                "--host", "0.0.0.0", "--port", "7000", "--mode", "Sequential", "--sweep-interval", "0"});

        // then
        assertThat(config.getHost()).isEqualTo("0.0.0.0");
        assertThat(config.getPort()).isEqualTo(7000);
        assertThat(config.getConnectionMode()).isEqualTo(ConnectionMode.SEQUENTIAL);
        assertThat(config.isSweepEnabled()).isFalse();
    }

    @Test
    void shouldKeepDefaultsForInvalidValues() {
        ServerConfig config = new ServerConfig();

        config.parseCommandLineArgs(new String[]{
                "--port", "abc", "--mode", "threaded", "--sweep-interval", "-5", "--unknown", "--port"});

        assertThat(config.getPort()).isEqualTo(ServerConfig.DEFAULT_PORT);
        assertThat(config.getConnectionMode()).isEqualTo(ConnectionMode.CONCURRENT);
        assertThat(config.getSweepIntervalMillis()).isEqualTo(ServerConfig.DEFAULT_SWEEP_INTERVAL_MILLIS);
    }

    @Test
    void shouldRejectOutOfRangePort() {
        ServerConfig config = new ServerConfig();

        config.parseCommandLineArgs(new String[]{"--port", "70000"});

        assertThat(config.getPort()).isEqualTo(ServerConfig.DEFAULT_PORT);
    }
}
