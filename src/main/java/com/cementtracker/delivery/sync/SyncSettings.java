package com.cementtracker.delivery.sync;

import com.cementtracker.delivery.config.Config;
import com.cementtracker.delivery.model.ReportRecord;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Sender and subject heuristics plus the nominal bag weight, handed to a session as data.
 * <p>
 * A keyword family is a list of term groups. A subject satisfies the family when it contains every
 * term of at least one group, so {@code weigh bridge,weighbridge} accepts both spellings.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class SyncSettings {
    public final String expectedSender;
    public final List<String> senderAliases;
    public final List<List<String>> topicKeywords;
    public final List<List<String>> kindKeywords;
    public final double nominalBagWeight;

    public static SyncSettings fromConfig(Config config) {
        return SyncSettings.builder()
                .expectedSender(config.getString("sync.expected_sender"))
                .senderAliases(lowerAll(config.getList("sync.sender_aliases")))
                .topicKeywords(parseGroups(config.getList("sync.subject.topic_keywords")))
                .kindKeywords(parseGroups(config.getList("sync.subject.kind_keywords")))
                .nominalBagWeight(config.getDouble("sync.nominal_bag_weight", ReportRecord.NOMINAL_BAG_WEIGHT_KG))
                .build();
    }

    public static SyncSettings defaults() {
        return SyncSettings.builder()
                .expectedSender("scale.sscil@sevenringscement.com")
                .senderAliases(List.of("scale.sscil", "sevenringscement"))
                .topicKeywords(parseGroups(List.of("weigh bridge", "weighbridge")))
                .kindKeywords(parseGroups(List.of("report", "repot")))
                .nominalBagWeight(ReportRecord.NOMINAL_BAG_WEIGHT_KG)
                .build();
    }

    static List<List<String>> parseGroups(List<String> rawGroups) {
        List<List<String>> groups = new ArrayList<>();
        if (rawGroups == null) {
            return groups;
        }
        for (String raw : rawGroups) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            List<String> terms = lowerAll(Arrays.asList(raw.trim().split("\\s+")));
            if (!terms.isEmpty()) {
                groups.add(List.copyOf(terms));
            }
        }
        return List.copyOf(groups);
    }

    private static List<String> lowerAll(List<String> values) {
        List<String> out = new ArrayList<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim().toLowerCase(Locale.ROOT));
            }
        }
        return List.copyOf(out);
    }
}
