package club.ppmc.dbgp;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.dbgp.config.DbgpSettings;
import club.ppmc.dbgp.controller.DbgpController;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {"dbgp.port=9300", "dbgp.source-context-radius=3"})
class DbgpDebuggerApplicationTests {

    @Autowired
    private DbgpController controller;

    @Autowired
    private DbgpSettings settings;

    @Test
    void contextLoadsWithConfiguredSettings() {
        assertThat(controller).isNotNull();
        assertThat(settings.port()).isEqualTo(9300);
        assertThat(settings.sourceContextRadius()).isEqualTo(3);
        assertThat(settings.commandTimeoutMs()).isEqualTo(10_000);
    }
}
