package io.github.metahealth.schema;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Set;

import static io.github.metahealth.schema.FieldStatus.MANDATORY;
import static io.github.metahealth.schema.FieldStatus.OPTIONAL;
import static io.github.metahealth.schema.FieldStatus.RECOMMENDED;

/**
 * The fixed taxonomy of tracked metadata fields.
 *
 * <p>{@link #datacite()} is the taxonomy the statistics are computed with. Other instances can be
 * built with {@link #of(List, Set)}, which is mainly useful to exercise the aggregation engine
 * against a small schema.</p>
 *
 * <p>Subfield extraction is table driven: every {@link SubfieldSpec} carries its own
 * {@link SubfieldExtractor}, so adding a subfield means adding a table entry below.</p>
 */
public final class MetadataSchema {

    public static final Set<String> RESOURCE_TYPES = ImmutableSet.of(
            "Audiovisual", "Book", "BookChapter", "Collection", "ComputationalNotebook",
            "ConferencePaper", "ConferenceProceeding", "Dataset", "Dissertation", "Event",
            "Image", "InteractiveResource", "Journal", "JournalArticle", "Model",
            "OutputManagementPlan", "PeerReview", "PhysicalObject", "Preprint", "Report",
            "Service", "Software", "Sound", "Standard", "Text", "Workflow", "Other", "Unknown");

    static final Set<String> NAME_TYPES = ImmutableSet.of("Personal", "Organizational");

    static final Set<String> NAME_IDENTIFIER_SCHEMES = ImmutableSet.of("ORCID", "ROR", "ISNI");

    static final Set<String> AFFILIATION_IDENTIFIER_SCHEMES = ImmutableSet.of("ROR", "GRID", "ISNI");

    static final Set<String> CONTRIBUTOR_TYPES = ImmutableSet.of(
            "ContactPerson", "DataCollector", "DataCurator", "DataManager", "Distributor",
            "Editor", "HostingInstitution", "Producer", "ProjectLeader", "ProjectManager",
            "ProjectMember", "RegistrationAgency", "RegistrationAuthority", "RelatedPerson",
            "Researcher", "ResearchGroup", "RightsHolder", "Sponsor", "Supervisor",
            "WorkPackageLeader", "Other");

    static final Set<String> RELATION_TYPES = ImmutableSet.of(
            "IsCitedBy", "Cites", "IsSupplementTo", "IsSupplementedBy", "IsContinuedBy",
            "Continues", "IsDescribedBy", "Describes", "HasMetadata", "IsMetadataFor",
            "HasVersion", "IsVersionOf", "IsNewVersionOf", "IsPreviousVersionOf", "IsPartOf",
            "HasPart", "IsPublishedIn", "IsReferencedBy", "References", "IsDocumentedBy",
            "Documents", "IsCompiledBy", "Compiles", "IsVariantFormOf", "IsOriginalFormOf",
            "IsIdenticalTo", "IsReviewedBy", "Reviews", "IsDerivedFrom", "IsSourceOf",
            "Requires", "IsRequiredBy", "Obsoletes", "IsObsoletedBy");

    static final Set<String> RELATED_IDENTIFIER_TYPES = ImmutableSet.of(
            "ARK", "arXiv", "bibcode", "DOI", "EAN13", "EISSN", "Handle", "IGSN", "ISBN",
            "ISSN", "ISTC", "LISSN", "LSID", "PMID", "PURL", "UPC", "URL", "URN", "w3id");

    static final Set<String> FUNDER_IDENTIFIER_TYPES = ImmutableSet.of("Crossref Funder ID", "ROR", "Other");

    private static final MetadataSchema DATACITE = buildDataCite();

    private final ImmutableList<FieldSpec> fields;
    private final ImmutableMap<String, FieldSpec> fieldsByName;
    private final ImmutableSet<String> resourceTypes;

    private MetadataSchema(List<FieldSpec> fields, Set<String> resourceTypes) {
        this.fields = ImmutableList.copyOf(fields);
        ImmutableMap.Builder<String, FieldSpec> byName = ImmutableMap.builder();
        for (FieldSpec field : fields) {
            byName.put(field.getName(), field);
        }
        this.fieldsByName = byName.buildOrThrow();
        this.resourceTypes = ImmutableSet.copyOf(resourceTypes);
    }

    public static MetadataSchema datacite() {
        return DATACITE;
    }

    public static MetadataSchema of(List<FieldSpec> fields, Set<String> resourceTypes) {
        return new MetadataSchema(fields, resourceTypes);
    }

    public ImmutableList<FieldSpec> getFields() {
        return fields;
    }

    public FieldSpec getField(String name) {
        return fieldsByName.get(name);
    }

    /**
     * The resource types a record can be attributed to in the per-type breakdown.
     */
    public ImmutableSet<String> getResourceTypes() {
        return resourceTypes;
    }

    public boolean isKnownResourceType(String resourceType) {
        return resourceType != null && resourceTypes.contains(resourceType);
    }

    public int countFields(FieldStatus status) {
        int count = 0;
        for (FieldSpec field : fields) {
            if (field.getStatus() == status) {
                count++;
            }
        }
        return count;
    }

    private static MetadataSchema buildDataCite() {
        return new MetadataSchema(List.of(
                FieldSpec.simple("identifier", MANDATORY),
                FieldSpec.repeatable("creators", MANDATORY, creatorSubfields()),
                FieldSpec.simple("titles", MANDATORY),
                FieldSpec.simple("publisher", MANDATORY),
                FieldSpec.simple("publicationYear", MANDATORY),
                FieldSpec.singular("resourceType", MANDATORY,
                        SubfieldSpec.enumerated("resourceTypeGeneral", RESOURCE_TYPES,
                                Extractors.text("resourceTypeGeneral"))),

                FieldSpec.simple("subjects", RECOMMENDED),
                FieldSpec.repeatable("contributors", RECOMMENDED, contributorSubfields()),
                FieldSpec.simple("date", RECOMMENDED),
                FieldSpec.repeatable("relatedIdentifiers", RECOMMENDED,
                        SubfieldSpec.enumerated("relationType", RELATION_TYPES,
                                Extractors.text("relationType")),
                        SubfieldSpec.enumerated("relatedIdentifierType", RELATED_IDENTIFIER_TYPES,
                                Extractors.text("relatedIdentifierType")),
                        SubfieldSpec.enumerated("resourceTypeGeneral", RESOURCE_TYPES,
                                Extractors.text("resourceTypeGeneral"))),
                FieldSpec.simple("description", RECOMMENDED),
                FieldSpec.simple("geoLocations", RECOMMENDED),

                FieldSpec.simple("language", OPTIONAL),
                FieldSpec.simple("alternateIdentifiers", OPTIONAL),
                FieldSpec.simple("sizes", OPTIONAL),
                FieldSpec.simple("formats", OPTIONAL),
                FieldSpec.simple("version", OPTIONAL),
                FieldSpec.simple("rights", OPTIONAL),
                FieldSpec.repeatable("fundingReferences", OPTIONAL,
                        SubfieldSpec.presence("funderName", Extractors.text("funderName")),
                        SubfieldSpec.presence("funderIdentifier", Extractors.text("funderIdentifier")),
                        SubfieldSpec.enumerated("funderIdentifierType", FUNDER_IDENTIFIER_TYPES,
                                Extractors.text("funderIdentifierType")),
                        SubfieldSpec.presence("awardNumber", Extractors.text("awardNumber")),
                        SubfieldSpec.presence("awardURI", Extractors.text("awardUri", "awardURI")),
                        SubfieldSpec.presence("awardTitle", Extractors.text("awardTitle"))),
                FieldSpec.simple("relatedItems", OPTIONAL)
        ), RESOURCE_TYPES);
    }

    private static SubfieldSpec[] creatorSubfields() {
        return new SubfieldSpec[]{
                SubfieldSpec.enumerated("nameType", NAME_TYPES, Extractors.text("nameType")),
                nameIdentifier(),
                nameIdentifierScheme(),
                affiliation(),
                affiliationIdentifier(),
                affiliationIdentifierScheme()
        };
    }

    private static SubfieldSpec[] contributorSubfields() {
        return new SubfieldSpec[]{
                SubfieldSpec.enumerated("contributorType", CONTRIBUTOR_TYPES, Extractors.text("contributorType")),
                nameIdentifier(),
                nameIdentifierScheme(),
                affiliation(),
                affiliationIdentifier(),
                affiliationIdentifierScheme()
        };
    }

    private static SubfieldSpec nameIdentifier() {
        return SubfieldSpec.presence("nameIdentifier", Extractors.entries("nameIdentifiers"));
    }

    private static SubfieldSpec nameIdentifierScheme() {
        return SubfieldSpec.enumerated("nameIdentifierScheme", NAME_IDENTIFIER_SCHEMES,
                Extractors.identifierSchemes("nameIdentifiers", "nameIdentifier", "nameIdentifierScheme"));
    }

    private static SubfieldSpec affiliation() {
        return SubfieldSpec.presence("affiliation", Extractors.entries("affiliation"));
    }

    private static SubfieldSpec affiliationIdentifier() {
        return SubfieldSpec.presence("affiliationIdentifier",
                Extractors.identifiedEntries("affiliation", "affiliationIdentifier"));
    }

    private static SubfieldSpec affiliationIdentifierScheme() {
        return SubfieldSpec.enumerated("affiliationIdentifierScheme", AFFILIATION_IDENTIFIER_SCHEMES,
                Extractors.identifierSchemes("affiliation", "affiliationIdentifier", "affiliationIdentifierScheme"));
    }
}
