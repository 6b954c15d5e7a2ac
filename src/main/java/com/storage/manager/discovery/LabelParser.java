package com.storage.manager.discovery;

import com.storage.manager.algorithm.AlgorithmCatalog;
import com.storage.manager.algorithm.CleanupAlgorithm;
import com.storage.manager.core.exception.ValidationException;
import com.storage.manager.core.model.RegistrationDraft;
import com.storage.manager.core.model.RegistrationKey;
import com.storage.manager.volume.ContainerInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses registration declarations out of container labels of the form
 * {@code <prefix>.<index>.<field>}.
 *
 * <p>Phase one groups matching labels by index. Phase two validates each group
 * independently: {@code volume}, {@code path} and {@code algorithm} are required,
 * {@code description} is optional, and every other field is handed to the algorithm
 * as a string parameter for validation and coercion.</p>
 */
public class LabelParser {
    private static final Logger log = LoggerFactory.getLogger(LabelParser.class);

    public static final String DEFAULT_PREFIX = "storage-manager";

    static final String FIELD_VOLUME = "volume";
    static final String FIELD_PATH = "path";
    static final String FIELD_ALGORITHM = "algorithm";
    static final String FIELD_DESCRIPTION = "description";
    private static final Set<String> RESERVED_FIELDS =
            Set.of(FIELD_VOLUME, FIELD_PATH, FIELD_ALGORITHM, FIELD_DESCRIPTION);

    private final Pattern labelPattern;
    private final AlgorithmCatalog algorithms;

    public LabelParser(AlgorithmCatalog algorithms) {
        this(DEFAULT_PREFIX, algorithms);
    }

    public LabelParser(String prefix, AlgorithmCatalog algorithms) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("label prefix must not be blank");
        }
        this.labelPattern = Pattern.compile("^" + Pattern.quote(prefix.trim()) + "\\.(\\d{1,9})\\.(.+)$");
        this.algorithms = algorithms;
    }

    public LabelParseResult parse(ContainerInfo container) {
        return parse(container.name(), container.labels());
    }

    public LabelParseResult parse(String containerName, Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) {
            return LabelParseResult.empty();
        }

        Map<Integer, Map<String, String>> groups = new TreeMap<>();
        for (Map.Entry<String, String> label : labels.entrySet()) {
            Matcher matcher = labelPattern.matcher(label.getKey());
            if (!matcher.matches()) {
                continue;
            }
            int index = Integer.parseInt(matcher.group(1));
            groups.computeIfAbsent(index, i -> new TreeMap<>()).put(matcher.group(2), label.getValue());
        }

        List<LabelParseResult.Discovered> drafts = new ArrayList<>();
        List<LabelParseResult.Rejection> rejections = new ArrayList<>();
        for (Map.Entry<Integer, Map<String, String>> group : groups.entrySet()) {
            try {
                drafts.add(new LabelParseResult.Discovered(group.getKey(), containerName, toDraft(group.getValue())));
            } catch (ValidationException e) {
                log.warn("labels.rejected container={} index={} reason={}", containerName, group.getKey(), e.getMessage());
                rejections.add(new LabelParseResult.Rejection(group.getKey(), containerName, e.getMessage()));
            }
        }
        return new LabelParseResult(drafts, rejections);
    }

    private RegistrationDraft toDraft(Map<String, String> fields) {
        String volume = required(fields, FIELD_VOLUME);
        String path = required(fields, FIELD_PATH);
        String algorithmId = required(fields, FIELD_ALGORITHM);

        Map<String, Object> params = new LinkedHashMap<>();
        for (Map.Entry<String, String> field : fields.entrySet()) {
            if (!RESERVED_FIELDS.contains(field.getKey())) {
                params.put(field.getKey(), field.getValue());
            }
        }

        RegistrationKey key = RegistrationKey.of(volume, path);
        CleanupAlgorithm algorithm = algorithms.get(algorithmId);
        algorithm.validate(params);
        return new RegistrationDraft(key.volumeName(), key.path(), algorithm.id(), params, fields.get(FIELD_DESCRIPTION));
    }

    private static String required(Map<String, String> fields, String name) {
        String value = fields.get(name);
        if (value == null || value.isBlank()) {
            throw new ValidationException("label field '" + name + "' is required");
        }
        return value.trim();
    }
}
