package no.cantara.mnoda;

import no.cantara.mnoda.model.Datum;
import no.cantara.mnoda.model.Document;
import no.cantara.mnoda.model.Identity;
import no.cantara.mnoda.model.Record;
import no.cantara.mnoda.model.Relationship;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Checks a decoded {@link Document} for problems that span several entries
 * and so cannot be caught while decoding a single record or relationship.
 *
 * <p>Returns a {@link ValidationResult} with separate {@code errors} (the
 * document cannot be ingested) and {@code warnings} (ingestion works but the
 * result is probably not what was meant).
 */
public class MnodaValidator {

    // "is emailed by", "was contained by"
    private static final Pattern PASSIVE_PREDICATE = Pattern.compile("^(is|are|was|were|been) .+ by$");

    /**
     * Immutable result of validating a document.
     *
     * @param errors   Conditions that make the document impossible to ingest (MUST fix).
     * @param warnings Conditions that are permitted but suspicious (SHOULD fix).
     */
    public record ValidationResult(List<String> errors, List<String> warnings) {
        public ValidationResult {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }

        public boolean isValid() { return errors.isEmpty(); }
        public boolean hasWarnings() { return !warnings.isEmpty(); }
    }

    public static ValidationResult validate(Document document) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (document.getRecords().isEmpty()) {
            warnings.add("document: no records");
        }

        Set<Identity> seenIds = new HashSet<>();
        for (Record record : document.getRecords()) {
            String p = "record '" + record.getId().value() + "'";

            if (!seenIds.add(record.getId())) {
                warnings.add(p + ": duplicate " + (record.getId().isLocal() ? "'local_id'" : "'id'")
                        + " (ingestion keeps only one of them)");
            }

            Set<String> datumNames = new HashSet<>();
            for (Datum datum : record.getData()) {
                if (!datumNames.add(datum.name())) {
                    warnings.add(p + ": duplicate datum name '" + datum.name() + "'");
                }
            }
        }

        Set<String> localIds = document.getRecords().stream()
                .map(Record::getId)
                .filter(Identity::isLocal)
                .map(Identity::value)
                .collect(Collectors.toSet());

        for (Relationship rel : document.getRelationships()) {
            String p = "relationship '" + rel.subject().value() + " " + rel.predicate() + " " + rel.object().value() + "'";
            if (rel.subject().isLocal() && !localIds.contains(rel.subject().value())) {
                errors.add(p + ": 'local_subject' is not the local_id of any record in the document");
            }
            if (rel.object().isLocal() && !localIds.contains(rel.object().value())) {
                errors.add(p + ": 'local_object' is not the local_id of any record in the document");
            }
            if (PASSIVE_PREDICATE.matcher(rel.predicate()).matches()) {
                warnings.add(p + ": predicate should be in the active voice");
            }
        }

        return new ValidationResult(errors, warnings);
    }
}
