package com.cementtracker.delivery.source;

import com.cementtracker.core.SourceUnavailableException;
import com.cementtracker.delivery.config.Config;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ImapMessageSourceTest {

    @Test
    void loadSettingsShouldApplyDefaultsAndOverrides() {
        Config config = Config.fromMap(Path.of("."), Map.of(
                "imap.host", "imap.example.com",
                "imap.ssl", "false",
                "imap.port", "",
                "imap.user", "ops",
                "app.zone", "Asia/Kolkata"
        ));

        ImapMessageSource.Settings settings = ImapMessageSource.loadSettings(config);

        assertEquals("imap.example.com", settings.host);
        assertFalse(settings.ssl);
        assertEquals(993, settings.port);
        assertEquals("INBOX", settings.folder);
        assertEquals(ZoneId.of("Asia/Kolkata"), settings.zone);
        assertEquals("imap://ops@imap.example.com:993/INBOX", new ImapMessageSource(settings).describe());
    }

    @Test
    void fetchWithoutHostShouldBeUnavailable() {
        ImapMessageSource.Settings settings = ImapMessageSource.loadSettings(Config.fromMap(Path.of("."), Map.of()));
        ImapMessageSource source = new ImapMessageSource(settings);

        assertThrows(SourceUnavailableException.class,
                () -> source.fetch(LocalDate.of(2024, 1, 5), LocalDate.of(2024, 1, 6)));
    }

    @Test
    void blankZoneShouldUseSystemDefault() {
        assertEquals(ZoneId.systemDefault(), ImapMessageSource.resolveZone(" "));
        assertEquals(ZoneId.of("UTC"), ImapMessageSource.resolveZone("UTC"));
    }
}
