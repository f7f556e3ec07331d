package com.trialwatch.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.trialwatch.model.ContactBundle;
import com.trialwatch.model.Modality;
import com.trialwatch.model.PartialDate;
import com.trialwatch.model.TrialRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Projects a registry study document into a {@link TrialRecord}. This is the only class that
 * reads the raw study tree.
 */
@Component
public class TrialNormalizer {

    private static final String IDENTIFICATION = "protocolSection.identificationModule";
    private static final String STATUS = "protocolSection.statusModule";
    private static final String DESIGN = "protocolSection.designModule";
    private static final String SPONSOR = "protocolSection.sponsorCollaboratorsModule.leadSponsor";
    private static final String OVERSIGHT = "protocolSection.oversightModule";
    private static final String CONTACTS = "protocolSection.contactsLocationsModule";

    /**
     * @return the normalized record, or empty when the document carries no trial identifier
     */
    public Optional<TrialRecord> normalize(JsonNode study) {
        if (study == null || !study.isObject()) {
            return Optional.empty();
        }
        String nctId = NestedPath.text(study, IDENTIFICATION + ".nctId", null);
        if (nctId == null) {
            // some endpoints only carry a top-level id
            nctId = NestedPath.text(study, "id", null);
        }
        if (nctId == null || nctId.isBlank()) {
            return Optional.empty();
        }

        JsonNode primaryCompletionStruct = NestedPath.resolve(study, STATUS + ".primaryCompletionDateStruct");
        JsonNode completionStruct = NestedPath.resolve(study, STATUS + ".completionDateStruct");
        PartialDate resultsFirstPost = PartialDateParser.parse(
                NestedPath.resolve(study, STATUS + ".resultsFirstPostDateStruct"));

        Interventions interventions = extractInterventions(study);

        return Optional.of(new TrialRecord(
                nctId.strip(),
                NestedPath.text(study, IDENTIFICATION + ".briefTitle", ""),
                NestedPath.text(study, IDENTIFICATION + ".officialTitle", ""),
                NestedPath.text(study, IDENTIFICATION + ".acronym", ""),
                NestedPath.text(study, STATUS + ".overallStatus", ""),
                NestedPath.text(study, DESIGN + ".studyType", ""),
                NestedPath.textList(study, DESIGN + ".phases"),
                NestedPath.integer(study, DESIGN + ".enrollmentInfo.count"),
                NestedPath.text(study, DESIGN + ".enrollmentInfo.type", ""),
                firstText(study, SPONSOR + ".name", IDENTIFICATION + ".organization.fullName"),
                firstText(study, SPONSOR + ".class", IDENTIFICATION + ".organization.class"),
                NestedPath.bool(study, OVERSIGHT + ".isFdaRegulatedDrug"),
                NestedPath.bool(study, OVERSIGHT + ".isFdaRegulatedDevice"),
                NestedPath.bool(study, OVERSIGHT + ".oversightHasDmc"),
                NestedPath.textList(study, "protocolSection.conditionsModule.conditions"),
                interventions.names(),
                interventions.types(),
                Modality.infer(interventions.types()),
                locationCount(study),
                extractContacts(study),
                PartialDateParser.parse(NestedPath.resolve(study, STATUS + ".startDateStruct")),
                PartialDateParser.parse(primaryCompletionStruct),
                NestedPath.text(primaryCompletionStruct, "type", null),
                PartialDateParser.parse(completionStruct),
                NestedPath.text(completionStruct, "type", null),
                PartialDateParser.parse(NestedPath.resolve(study, STATUS + ".lastUpdatePostDateStruct")),
                resultsFirstPost,
                hasResults(study, resultsFirstPost)
        ));
    }

    private static String firstText(JsonNode study, String primaryPath, String fallbackPath) {
        String value = NestedPath.text(study, primaryPath, null);
        return value != null ? value : NestedPath.text(study, fallbackPath, "");
    }

    private static Interventions extractInterventions(JsonNode study) {
        JsonNode items = NestedPath.resolve(study, "protocolSection.armsInterventionsModule.interventions");
        Set<String> names = new LinkedHashSet<>();
        Set<String> types = new LinkedHashSet<>();
        if (items.isArray()) {
            for (JsonNode item : items) {
                if (!item.isObject()) {
                    continue;
                }
                addStripped(names, item.get("name"));
                addStripped(types, item.get("type"));
            }
        }
        return new Interventions(new ArrayList<>(names), new ArrayList<>(types));
    }

    private static void addStripped(Set<String> target, JsonNode node) {
        if (node != null && node.isTextual() && !node.textValue().isBlank()) {
            target.add(node.textValue().strip());
        }
    }

    private static Integer locationCount(JsonNode study) {
        JsonNode locations = NestedPath.resolve(study, CONTACTS + ".locations");
        if (isEmpty(locations)) {
            locations = NestedPath.resolve(study, "protocolSection.locationsModule.locations");
        }
        if (isEmpty(locations)) {
            return 0;
        }
        return locations.isArray() ? locations.size() : null;
    }

    private static boolean isEmpty(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return true;
        }
        if (node.isContainerNode()) {
            return node.size() == 0;
        }
        return node.isTextual() && node.textValue().isEmpty();
    }

    private static ContactBundle extractContacts(JsonNode study) {
        JsonNode module = NestedPath.resolve(study, CONTACTS);
        List<ContactBundle.CentralContact> central = new ArrayList<>();
        List<ContactBundle.OverallOfficial> officials = new ArrayList<>();

        JsonNode centralNodes = NestedPath.resolve(module, "centralContacts");
        if (centralNodes.isArray()) {
            for (JsonNode c : centralNodes) {
                if (c.isObject()) {
                    central.add(new ContactBundle.CentralContact(
                            NestedPath.text(c, "name", null),
                            NestedPath.text(c, "role", null),
                            NestedPath.text(c, "phone", null),
                            NestedPath.text(c, "email", null)));
                }
            }
        }

        JsonNode officialNodes = NestedPath.resolve(module, "overallOfficials");
        if (officialNodes.isArray()) {
            for (JsonNode o : officialNodes) {
                if (o.isObject()) {
                    officials.add(new ContactBundle.OverallOfficial(
                            NestedPath.text(o, "name", null),
                            NestedPath.text(o, "affiliation", null),
                            NestedPath.text(o, "role", null)));
                }
            }
        }
        return new ContactBundle(central, officials);
    }

    private static boolean hasResults(JsonNode study, PartialDate resultsFirstPost) {
        JsonNode flag = study.get("hasResults");
        if (flag != null && !flag.isNull()) {
            return flag.asBoolean();
        }
        // single-study responses may omit the flag
        return resultsFirstPost.hasRaw();
    }

    private record Interventions(List<String> names, List<String> types) {}
}
