package com.civiclens.ingestion.normalizer;

import com.civiclens.domain.Bill;
import com.civiclens.domain.BillAction;
import com.civiclens.domain.BillCosponsor;
import com.civiclens.domain.BillKey;
import com.civiclens.domain.BillSubject;
import com.civiclens.domain.BillSummary;
import com.civiclens.domain.BillTextVersion;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps Congress.gov bill payloads onto {@link Bill} and its child documents.
 * Missing key fields raise IllegalArgumentException; the caller records them per bill.
 */
@Component
public class BillNormalizer {

    public BillKey keyOf(JsonNode item) {
        return new BillKey(
                JsonFields.requiredInt(item, "congress"),
                JsonFields.requiredText(item, "type"),
                JsonFields.requiredInt(item, "number"));
    }

    /** Upstream updateDate of a list item; the value the fromDateTime filter applies to. */
    public Instant updateDateOf(JsonNode item) {
        return JsonFields.instant(item, "updateDate");
    }

    /**
     * Overwrites the mutable top-level fields from a detail response ({@code {"bill": {...}}} or the bare object).
     */
    public void applyDetail(Bill bill, JsonNode detailRoot) {
        JsonNode node = detailRoot.has("bill") ? detailRoot.get("bill") : detailRoot;
        BillKey key = keyOf(node);
        bill.setCongress(key.congress());
        bill.setBillType(key.billType());
        bill.setBillNumber(key.billNumber());
        bill.setSlug(key.slug());
        bill.setTitle(JsonFields.text(node, "title"));
        bill.setOriginChamber(JsonFields.text(node, "originChamber"));
        bill.setIntroducedDate(JsonFields.localDate(node, "introducedDate"));
        bill.setUpdateDate(JsonFields.instant(node, "updateDate"));
        bill.setUrl(JsonFields.text(node, "url"));

        JsonNode latestAction = node.path("latestAction");
        bill.setLatestActionDate(JsonFields.localDate(latestAction, "actionDate"));
        bill.setLatestActionText(JsonFields.text(latestAction, "text"));
        bill.setPolicyArea(JsonFields.text(node.path("policyArea"), "name"));

        JsonNode sponsor = node.path("sponsors").path(0);
        bill.setSponsorBioguideId(JsonFields.text(sponsor, "bioguideId"));
        bill.setSponsorFullName(JsonFields.text(sponsor, "fullName"));
        bill.setSponsorParty(JsonFields.text(sponsor, "party"));
        bill.setSponsorState(JsonFields.text(sponsor, "state"));

        JsonNode law = node.path("laws").path(0);
        String lawNumber = JsonFields.text(law, "number");
        bill.setLawNumber(lawNumber);
        bill.setLaw(lawNumber != null);

        Integer cosponsorCount = JsonFields.integer(node.path("cosponsors"), "count");
        bill.setCosponsorCount(cosponsorCount != null ? cosponsorCount : 0);
    }

    public List<BillAction> actions(List<JsonNode> items) {
        List<BillAction> actions = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            BillAction action = new BillAction();
            action.setActionDate(JsonFields.localDate(item, "actionDate"));
            action.setActionCode(JsonFields.text(item, "actionCode"));
            action.setText(JsonFields.text(item, "text"));
            action.setType(JsonFields.text(item, "type"));
            String sourceSystem = JsonFields.text(item.path("sourceSystem"), "name");
            action.setSourceSystem(sourceSystem);
            action.setChamber(chamberOf(JsonFields.text(item, "chamber"), sourceSystem));
            actions.add(action);
        }
        return actions;
    }

    /** Subjects response is an object: legislativeSubjects[] plus the policyArea. */
    public List<BillSubject> subjects(JsonNode subjectsRoot) {
        JsonNode subjects = subjectsRoot.has("subjects") ? subjectsRoot.get("subjects") : subjectsRoot;
        List<BillSubject> result = new ArrayList<>();
        for (JsonNode item : subjects.path("legislativeSubjects")) {
            String name = JsonFields.text(item, "name");
            if (name != null) {
                result.add(subject(name, false));
            }
        }
        String policyArea = JsonFields.text(subjects.path("policyArea"), "name");
        if (policyArea != null) {
            result.add(subject(policyArea, true));
        }
        return result;
    }

    public List<BillSummary> summaries(List<JsonNode> items) {
        List<BillSummary> summaries = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            BillSummary summary = new BillSummary();
            summary.setVersionCode(JsonFields.text(item, "versionCode"));
            summary.setActionDate(JsonFields.localDate(item, "actionDate"));
            summary.setActionDesc(JsonFields.text(item, "actionDesc"));
            summary.setText(JsonFields.text(item, "text"));
            summary.setUpdateDate(JsonFields.instant(item, "updateDate"));
            summaries.add(summary);
        }
        return summaries;
    }

    public List<BillCosponsor> cosponsors(List<JsonNode> items) {
        List<BillCosponsor> cosponsors = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            BillCosponsor cosponsor = new BillCosponsor();
            cosponsor.setBioguideId(JsonFields.requiredText(item, "bioguideId"));
            cosponsor.setFullName(JsonFields.text(item, "fullName"));
            cosponsor.setParty(JsonFields.text(item, "party"));
            cosponsor.setState(JsonFields.text(item, "state"));
            cosponsor.setSponsorshipDate(JsonFields.localDate(item, "sponsorshipDate"));
            cosponsor.setOriginalCosponsor(item.path("isOriginalCosponsor").asBoolean(false));
            cosponsors.add(cosponsor);
        }
        return cosponsors;
    }

    public List<BillTextVersion> textVersions(List<JsonNode> items) {
        List<BillTextVersion> versions = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            BillTextVersion version = new BillTextVersion();
            version.setType(JsonFields.text(item, "type"));
            version.setDate(JsonFields.instant(item, "date"));
            for (JsonNode format : item.path("formats")) {
                String url = JsonFields.text(format, "url");
                String type = JsonFields.text(format, "type");
                if (url == null || type == null) {
                    continue;
                }
                String lowerType = type.toLowerCase(Locale.ROOT);
                if (lowerType.contains("pdf")) {
                    version.setPdfUrl(url);
                } else if (lowerType.contains("xml")) {
                    version.setXmlUrl(url);
                } else if (url.endsWith(".txt")) {
                    version.setTxtUrl(url);
                } else {
                    version.setHtmlUrl(url);
                }
            }
            versions.add(version);
        }
        return versions;
    }

    private static BillSubject subject(String name, boolean policyArea) {
        BillSubject subject = new BillSubject();
        subject.setName(name);
        subject.setPolicyArea(policyArea);
        return subject;
    }

    private static String chamberOf(String chamber, String sourceSystem) {
        if (chamber != null) {
            return chamber;
        }
        if (sourceSystem == null) {
            return null;
        }
        if (sourceSystem.startsWith("House")) {
            return "House";
        }
        if (sourceSystem.startsWith("Senate")) {
            return "Senate";
        }
        return null;
    }
}
