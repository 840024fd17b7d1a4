package com.civiclens.ingestion.normalizer;

import com.civiclens.domain.Hearing;
import com.civiclens.domain.HearingKey;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Maps Congress.gov hearing list items and detail responses onto {@link Hearing}.
 */
@Component
public class HearingNormalizer {

    public HearingKey keyOf(JsonNode item) {
        return new HearingKey(
                JsonFields.requiredInt(item, "congress"),
                JsonFields.requiredText(item, "chamber"),
                JsonFields.requiredInt(item, "jacketNumber"));
    }

    public Instant updateDateOf(JsonNode item) {
        return JsonFields.instant(item, "updateDate");
    }

    /** Applies a detail response ({@code {"hearing": {...}}} or the bare object). */
    public void apply(Hearing hearing, HearingKey key, JsonNode detailRoot) {
        JsonNode node = detailRoot.has("hearing") ? detailRoot.get("hearing") : detailRoot;
        hearing.setCongress(key.congress());
        hearing.setChamber(key.chamber());
        hearing.setJacketNumber(key.jacketNumber());
        hearing.setTitle(JsonFields.text(node, "title"));
        hearing.setDate(JsonFields.instant(node.path("dates").path(0), "date"));
        hearing.setLocation(JsonFields.text(node, "location"));
        JsonNode committee = node.path("committees").path(0);
        hearing.setCommitteeCode(JsonFields.text(committee, "systemCode"));
        hearing.setCommitteeName(JsonFields.text(committee, "name"));
        hearing.setUrl(JsonFields.text(node, "url"));
        hearing.setUpdateDate(JsonFields.instant(node, "updateDate"));
    }
}
