package io.github.yok.itgluemigrate.core;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.yok.itgluemigrate.client.ApiResponses;
import io.github.yok.itgluemigrate.parser.OrganizationRecord;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Matches exported organizations to organizations that already exist in the destination.
 *
 * <p>
 * An organization matches by the {@code metadata.itglue_id} stored by an earlier migration, then
 * by case-insensitive name; otherwise it is marked for creation. Results are keyed by the
 * exported name, or by the id when the name is empty.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class OrganizationMatcher {

    private final Map<String, String> byItglueId = new HashMap<>();
    private final Map<String, List<String>> byLowerName = new HashMap<>();
    private final Map<String, MatchResult> matched = new LinkedHashMap<>();

    /**
     * Indexes the existing organizations.
     *
     * @param existingOrgs organizations returned by the destination
     */
    public OrganizationMatcher(List<JsonNode> existingOrgs) {
        for (JsonNode org : existingOrgs) {
            String uuid = ApiResponses.text(org, "id");
            if (uuid == null) {
                log.warn("Skipping existing org without id: {}", org);
                continue;
            }
            String itglueId = ApiResponses.text(org.path("metadata"), "itglue_id");
            if (itglueId != null) {
                String previous = byItglueId.put(itglueId, uuid);
                if (previous != null) {
                    log.warn("Duplicate itglue_id '{}' found in existing orgs: {} and {}",
                            itglueId, previous, uuid);
                }
            }
            String name = ApiResponses.text(org, "name");
            if (name != null) {
                byLowerName.computeIfAbsent(name.toLowerCase(Locale.ROOT),
                        k -> new ArrayList<>()).add(uuid);
            }
        }
        log.debug("OrganizationMatcher initialized: {} by itglue_id, {} unique names",
                byItglueId.size(), byLowerName.size());
    }

    /**
     * Matches one exported organization and records the result.
     *
     * @param org exported organization
     * @return match result
     */
    public MatchResult match(OrganizationRecord org) {
        String itglueId = org.getId();
        String name = org.getName();
        String key = StringUtils.isNotEmpty(name) ? name
                : StringUtils.defaultIfEmpty(itglueId, "<unknown>");

        MatchResult result;
        if (itglueId != null && byItglueId.containsKey(itglueId)) {
            result = MatchResult.matchedByItglueId(byItglueId.get(itglueId));
            log.debug("Matched org '{}' by itglue_id '{}' -> {}", name, itglueId,
                    result.getUuid());
        } else if (StringUtils.isNotEmpty(name)
                && byLowerName.containsKey(name.toLowerCase(Locale.ROOT))) {
            List<String> uuids = byLowerName.get(name.toLowerCase(Locale.ROOT));
            if (uuids.size() > 1) {
                log.warn("Multiple existing orgs match name '{}': {} (using first)", name, uuids);
            }
            result = MatchResult.matchedByName(uuids.get(0));
            log.debug("Matched org '{}' by name -> {}", name, result.getUuid());
        } else {
            if (StringUtils.isEmpty(name)) {
                log.warn("Org id='{}' has no name, will create with empty name", itglueId);
            }
            result = MatchResult.needsCreation();
            log.debug("No match for org '{}' (itglue_id={}), will create", name, itglueId);
        }
        matched.put(key, result);
        return result;
    }

    /**
     * Returns the results recorded so far.
     *
     * @return {@code organization name → result}
     */
    public Map<String, MatchResult> getMapping() {
        return new LinkedHashMap<>(matched);
    }

    /**
     * Counts the recorded results.
     *
     * @return counts for {@code matched_by_itglue_id}, {@code matched_by_name} and {@code create}
     */
    public Map<String, Integer> getStats() {
        Map<String, Integer> stats = new LinkedHashMap<>();
        stats.put("matched_by_itglue_id", 0);
        stats.put("matched_by_name", 0);
        stats.put("create", 0);
        for (MatchResult result : matched.values()) {
            if (MatchResult.STATUS_CREATE.equals(result.getStatus())) {
                stats.merge("create", 1, Integer::sum);
            } else if (MatchResult.BY_ITGLUE_ID.equals(result.getMatchType())) {
                stats.merge("matched_by_itglue_id", 1, Integer::sum);
            } else if (MatchResult.BY_NAME.equals(result.getMatchType())) {
                stats.merge("matched_by_name", 1, Integer::sum);
            }
        }
        return stats;
    }
}
