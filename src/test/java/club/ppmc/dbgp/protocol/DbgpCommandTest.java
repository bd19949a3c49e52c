package club.ppmc.dbgp.protocol;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class DbgpCommandTest {

    @Test
    void placesTransactionIdAfterArguments() {
        DbgpCommand command = DbgpCommand.of("context_get", "-c", "1");

        assertThat(command.toCommandLine(7)).isEqualTo("context_get -c 1 -i 7");
    }

    @Test
    void appendsBase64DataAfterTransactionId() {
        DbgpCommand command = DbgpCommand.of("breakpoint_set", "-t", "line", "-f", "file:///C:/a.ahk", "-n", "10")
                .withData("x > 5");

        assertThat(command.data()).isEqualTo("eCA+IDU=");
        assertThat(command.toCommandLine(3))
                .isEqualTo("breakpoint_set -t line -f file:///C:/a.ahk -n 10 -i 3 -- eCA+IDU=");
    }

    @Test
    void encodesWithSingleTrailingNul() {
        byte[] bytes = DbgpCommand.of("run").encode(1);

        assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("run -i 1\0");
    }

    @Test
    void describeOmitsData() {
        DbgpCommand command = DbgpCommand.of("eval").withData("secret");

        assertThat(command.describe()).isEqualTo("eval");
        assertThat(DbgpCommand.of("breakpoint_remove", "-d", "5").describe()).isEqualTo("breakpoint_remove -d 5");
    }
}
