package com.civiclens.ingestion.normalizer;

import com.civiclens.domain.Member;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Maps Congress.gov member list items onto {@link Member}.
 */
@Component
public class MemberNormalizer {

    public String bioguideIdOf(JsonNode item) {
        return JsonFields.requiredText(item, "bioguideId");
    }

    public Instant updateDateOf(JsonNode item) {
        return JsonFields.instant(item, "updateDate");
    }

    public void apply(Member member, JsonNode item) {
        member.setBioguideId(bioguideIdOf(item));
        applyName(member, item);
        member.setState(JsonFields.text(item, "state"));
        member.setDistrict(JsonFields.integer(item, "district"));
        String party = JsonFields.text(item, "partyName");
        member.setParty(party != null ? party : JsonFields.text(item, "party"));
        member.setChamber(latestChamber(item));
        member.setImageUrl(JsonFields.text(item.path("depiction"), "imageUrl"));
        member.setUrl(JsonFields.text(item, "url"));
        member.setUpdateDate(updateDateOf(item));
    }

    /** List items carry "Last, First"; detail items carry firstName/lastName/directOrderName. */
    private static void applyName(Member member, JsonNode item) {
        String first = JsonFields.text(item, "firstName");
        String last = JsonFields.text(item, "lastName");
        String name = JsonFields.text(item, "name");
        if ((first == null || last == null) && name != null) {
            int comma = name.indexOf(',');
            if (comma > 0) {
                last = name.substring(0, comma).trim();
                first = name.substring(comma + 1).trim();
            }
        }
        member.setFirstName(first);
        member.setLastName(last);
        String direct = JsonFields.text(item, "directOrderName");
        if (direct != null) {
            member.setFullName(direct);
        } else if (first != null && last != null) {
            member.setFullName(first + " " + last);
        } else {
            member.setFullName(name);
        }
    }

    private static String latestChamber(JsonNode item) {
        JsonNode terms = item.path("terms");
        JsonNode termItems = terms.isArray() ? terms : terms.path("item");
        if (!termItems.isArray() || termItems.isEmpty()) {
            return null;
        }
        String chamber = JsonFields.text(termItems.get(termItems.size() - 1), "chamber");
        if (chamber == null) {
            return null;
        }
        return chamber.startsWith("House") ? "House" : chamber.startsWith("Senate") ? "Senate" : chamber;
    }
}
