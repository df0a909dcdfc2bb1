package com.record.merge.preview;

import com.record.merge.core.model.CrmRecord;
import com.record.merge.core.model.RecordType;
import com.record.merge.logging.LogContext;
import com.record.merge.merge.AssociationMigrator;
import com.record.merge.merge.AttributePrecedenceResolver;
import com.record.merge.merge.AttributeSource;
import com.record.merge.store.RecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Builds the merge selection table for two records: each attribute side by side with the
 * side a merge would keep by default, rendered custom fields and association counts.
 */
public class MergePreviewService {
    private static final Logger log = LoggerFactory.getLogger(MergePreviewService.class);

    private final RecordRepository recordRepository;
    private final AssociationMigrator associationMigrator;
    private final AttributePrecedenceResolver precedenceResolver;
    private final CustomFieldRenderer renderer;
    private final List<FieldGroup> fieldGroups = new CopyOnWriteArrayList<>();

    public MergePreviewService(RecordRepository recordRepository,
                               AssociationMigrator associationMigrator,
                               AttributePrecedenceResolver precedenceResolver) {
        this(recordRepository, associationMigrator, precedenceResolver, new CustomFieldRenderer(), List.of());
    }

    public MergePreviewService(RecordRepository recordRepository,
                               AssociationMigrator associationMigrator,
                               AttributePrecedenceResolver precedenceResolver,
                               CustomFieldRenderer renderer,
                               Collection<FieldGroup> fieldGroups) {
        this.recordRepository = recordRepository;
        this.associationMigrator = associationMigrator;
        this.precedenceResolver = precedenceResolver;
        this.renderer = renderer;
        this.fieldGroups.addAll(fieldGroups);
    }

    public void registerFieldGroup(FieldGroup group) {
        fieldGroups.add(group);
    }

    public List<FieldGroup> fieldGroupsFor(RecordType type) {
        return fieldGroups.stream().filter(g -> g.recordType() == type).toList();
    }

    /**
     * @return the preview, or empty when either record does not exist
     * @throws IllegalArgumentException for a record previewed against itself
     */
    public Optional<MergePreview> preview(RecordType type, String duplicateId, String masterId) {
        if (duplicateId.equals(masterId)) {
            throw new IllegalArgumentException("A record cannot be merged into itself");
        }
        try (LogContext ctx = LogContext.forPreview(LogContext.generateCorrelationId(),
                type.name(), duplicateId, masterId)) {
            Optional<CrmRecord> duplicate = recordRepository.findById(type, duplicateId);
            Optional<CrmRecord> master = recordRepository.findById(type, masterId);
            if (duplicate.isEmpty() || master.isEmpty()) {
                log.debug("preview.not_found type={} duplicateId={} masterId={}", type, duplicateId, masterId);
                return Optional.empty();
            }
            MergePreview preview = build(type, duplicate.get(), master.get());
            log.debug("preview.built type={} attributes={} fieldGroups={}",
                    type, preview.attributes().size(), preview.customFields().size());
            return Optional.of(preview);
        }
    }

    private MergePreview build(RecordType type, CrmRecord duplicate, CrmRecord master) {
        Map<String, Object> duplicateAttributes = duplicate.getMergeAttributes();
        Map<String, Object> masterAttributes = master.getMergeAttributes();
        Map<String, AttributeSource> defaults =
                precedenceResolver.defaultPrecedence(duplicateAttributes, masterAttributes);

        List<FieldGroup> groups = fieldGroupsFor(type);
        Set<String> groupedFields = new HashSet<>();
        groups.forEach(g -> g.fields().forEach(f -> groupedFields.add(f.name())));

        Set<String> names = new LinkedHashSet<>(masterAttributes.keySet());
        names.addAll(duplicateAttributes.keySet());
        List<AttributeComparison> attributes = new ArrayList<>();
        for (String name : names) {
            if (groupedFields.contains(name)) {
                continue;
            }
            attributes.add(new AttributeComparison(name, humanize(name),
                    masterAttributes.get(name), duplicateAttributes.get(name), defaults.get(name)));
        }

        Map<String, List<AttributeComparison>> customFields = new LinkedHashMap<>();
        for (FieldGroup group : groups) {
            Map<String, String> masterRendered = renderer.render(group, master);
            Map<String, String> duplicateRendered = renderer.render(group, duplicate);
            List<AttributeComparison> rows = new ArrayList<>();
            for (CustomField field : group.sortedFields()) {
                rows.add(new AttributeComparison(field.name(), field.label(),
                        masterRendered.get(field.name()), duplicateRendered.get(field.name()),
                        defaults.get(field.name())));
            }
            customFields.put(group.label(), rows);
        }

        return new MergePreview(type, duplicate.getId(), master.getId(), attributes, customFields,
                associationMigrator.countChildren(type, master.getId()),
                associationMigrator.countChildren(type, duplicate.getId()),
                master.getTags(), duplicate.getTags());
    }

    static String humanize(String attribute) {
        String name = attribute.startsWith(RecordType.CUSTOM_FIELD_PREFIX)
                ? attribute.substring(RecordType.CUSTOM_FIELD_PREFIX.length()) : attribute;
        if (name.endsWith("_id")) {
            name = name.substring(0, name.length() - 3);
        }
        String spaced = name.replace('_', ' ').trim();
        if (spaced.isEmpty()) {
            return attribute;
        }
        return Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
    }
}
