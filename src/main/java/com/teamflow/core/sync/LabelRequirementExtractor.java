package com.teamflow.core.sync;

import com.teamflow.core.model.Capability;
import com.teamflow.core.model.Complexity;
import com.teamflow.core.model.Priority;
import com.teamflow.core.model.WorkRequirements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives requirements from prefixed labels and the issue body.
 * <p>
 * Labels: {@code lang:}, {@code framework:}, {@code domain:}, {@code cap:},
 * {@code priority:}, {@code type:}, {@code complexity:}, {@code estimate:<minutes>}.
 * Unprefixed labels become required capabilities, except the ones this service
 * writes itself ({@code status:*}, {@code teamflow:*}, {@code epic:*}, {@code needs-human}).
 * Body lines {@code depends on #12} become dependencies, {@code - [ ] ...} become acceptance criteria.
 */
@Component
public class LabelRequirementExtractor implements WorkRequirementExtractor {

    private static final Logger log = LoggerFactory.getLogger(LabelRequirementExtractor.class);

    private static final Pattern DEPENDS_ON = Pattern.compile("(?i)depends\\s+on\\s+#(\\d+)");
    private static final Pattern CHECKBOX = Pattern.compile("(?m)^\\s*[-*]\\s*\\[[ xX]]\\s*(.+?)\\s*$");

    @Override
    public WorkRequirements extract(TrackerIssue issue) {
        Set<Capability> required = new LinkedHashSet<>();
        Set<Capability> languages = new LinkedHashSet<>();
        Set<Capability> frameworks = new LinkedHashSet<>();
        Set<Capability> domains = new LinkedHashSet<>();
        String issueType = null;
        Priority priority = null;
        Complexity complexity = null;
        Integer estimate = null;

        for (String label : issue.labels()) {
            if (isOwnLabel(label)) {
                continue;
            }
            int colon = label.indexOf(':');
            String prefix = colon < 0 ? "" : label.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = colon < 0 ? label : label.substring(colon + 1).trim();
            if (value.isBlank()) {
                continue;
            }
            switch (prefix) {
                case "lang", "language" -> languages.add(Capability.language(value));
                case "framework", "fw" -> frameworks.add(Capability.framework(value));
                case "domain" -> domains.add(Capability.domain(value));
                case "priority" -> priority = parseEnum(Priority.class, value, issue);
                case "complexity" -> complexity = parseEnum(Complexity.class, value, issue);
                case "type" -> issueType = value.toLowerCase(Locale.ROOT);
                case "estimate" -> estimate = parseMinutes(value, issue);
                default -> required.add(Capability.of(value));
            }
        }

        return new WorkRequirements(required, null, languages, frameworks, domains, issueType, priority,
                complexity, estimate, dependencies(issue.body()), acceptanceCriteria(issue.body()));
    }

    static Set<String> dependencies(String body) {
        Set<String> ids = new LinkedHashSet<>();
        Matcher m = DEPENDS_ON.matcher(body);
        while (m.find()) {
            ids.add(TrackerEventHandler.issueId(Integer.parseInt(m.group(1))));
        }
        return ids;
    }

    static List<String> acceptanceCriteria(String body) {
        List<String> criteria = new ArrayList<>();
        Matcher m = CHECKBOX.matcher(body);
        while (m.find()) {
            criteria.add(m.group(1));
        }
        return criteria;
    }

    private static boolean isOwnLabel(String label) {
        String l = label.toLowerCase(Locale.ROOT);
        return l.startsWith(TrackerSync.STATUS_LABEL_PREFIX) || l.startsWith("teamflow:")
                || l.startsWith(TrackerEventHandler.EPIC_LABEL_PREFIX) || l.equals(TrackerSync.HUMAN_LABEL);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, TrackerIssue issue) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unknown {} '{}' on issue #{}", type.getSimpleName().toLowerCase(Locale.ROOT),
                    value, issue.number());
            return null;
        }
    }

    private static Integer parseMinutes(String value, TrackerIssue issue) {
        try {
            return Integer.valueOf(value.replaceAll("(?i)m(in)?$", "").trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring unparseable estimate '{}' on issue #{}", value, issue.number());
            return null;
        }
    }
}
