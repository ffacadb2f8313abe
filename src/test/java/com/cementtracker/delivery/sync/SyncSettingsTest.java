package com.cementtracker.delivery.sync;

import com.cementtracker.delivery.config.Config;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SyncSettingsTest {

    @Test
    void fromConfigShouldSplitKeywordGroupsIntoTerms() {
        Config config = Config.fromMap(Path.of("."), Map.of(
                "sync.subject.topic_keywords", "Weigh  Bridge, WEIGHBRIDGE ;",
                "sync.nominal_bag_weight", "40"
        ));

        SyncSettings settings = SyncSettings.fromConfig(config);

        assertEquals(List.of(List.of("weigh", "bridge"), List.of("weighbridge")), settings.topicKeywords);
        assertEquals(List.of(List.of("report"), List.of("repot")), settings.kindKeywords);
        assertEquals(40.0, settings.nominalBagWeight, 1e-12);
        assertEquals(List.of("scale.sscil", "sevenringscement"), settings.senderAliases);
    }

    @Test
    void defaultsShouldMatchBuiltInConfig() {
        SyncSettings fromDefaults = SyncSettings.fromConfig(Config.fromMap(Path.of("."), Map.of()));

        assertEquals(SyncSettings.defaults(), fromDefaults);
    }
}
