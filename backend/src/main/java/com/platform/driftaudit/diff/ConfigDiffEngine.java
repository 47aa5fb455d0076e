package com.platform.driftaudit.diff;

import com.platform.driftaudit.value.ConfigValue;
import com.platform.driftaudit.value.ConfigValue.MappingValue;
import com.platform.driftaudit.value.ConfigValue.SequenceValue;
import com.platform.driftaudit.value.ValueComparator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Recursive structural diff between two configuration trees.
 * 
 * Mapping keys are visited in sorted order (baseline keys first, then keys only present in
 * current) so the same pair of snapshots always yields the same change sequence.
 * Sequences of different length are reported as one modification of the whole sequence.
 */
@Slf4j
@Component
public class ConfigDiffEngine {
    
    private static final Predicate<String> NO_EXCLUSIONS = key -> false;
    
    public List<FieldChange> diff(String path, ConfigValue baseline, ConfigValue current) {
        return diff(path, baseline, current, NO_EXCLUSIONS);
    }
    
    /**
     * Diff with an exclusion on added mapping keys.
     *
     * @param excludeAddedKey keys present only in {@code current} that this accepts are not reported
     */
    public List<FieldChange> diff(String path, ConfigValue baseline, ConfigValue current,
                                  Predicate<String> excludeAddedKey) {
        List<FieldChange> changes = new ArrayList<>();
        compare(path == null ? "" : path, baseline, current, excludeAddedKey, changes);
        log.debug("Diff at '{}' produced {} change(s)", path, changes.size());
        return List.copyOf(changes);
    }
    
    private void compare(String path, ConfigValue baseline, ConfigValue current,
                         Predicate<String> excludeAddedKey, List<FieldChange> changes) {
        boolean baselineMissing = baseline == null || baseline.isNull();
        boolean currentMissing = current == null || current.isNull();
        
        if (baselineMissing && currentMissing) {
            return;
        }
        if (baselineMissing) {
            changes.add(new FieldChange(path, baseline, current, ChangeKind.ADDED));
            return;
        }
        if (currentMissing) {
            changes.add(new FieldChange(path, baseline, current, ChangeKind.REMOVED));
            return;
        }
        
        if (baseline instanceof MappingValue baselineMap) {
            if (current instanceof MappingValue currentMap) {
                compareMappings(path, baselineMap, currentMap, excludeAddedKey, changes);
            } else {
                changes.add(FieldChange.modified(path, baseline, current));
            }
            return;
        }
        
        if (baseline instanceof SequenceValue baselineSeq) {
            if (current instanceof SequenceValue currentSeq) {
                compareSequences(path, baselineSeq, currentSeq, excludeAddedKey, changes);
            } else {
                changes.add(FieldChange.modified(path, baseline, current));
            }
            return;
        }
        
        if (!ValueComparator.equal(baseline, current)) {
            changes.add(FieldChange.modified(path, baseline, current));
        }
    }
    
    private void compareMappings(String path, MappingValue baseline, MappingValue current,
                                 Predicate<String> excludeAddedKey, List<FieldChange> changes) {
        for (String key : new TreeSet<>(baseline.entries().keySet())) {
            String fieldPath = joinPath(path, key);
            if (current.containsKey(key)) {
                if (isExcludedAddition(key, baseline.get(key), current.get(key), excludeAddedKey)) {
                    continue;
                }
                compare(fieldPath, baseline.get(key), current.get(key), excludeAddedKey, changes);
            } else {
                changes.add(FieldChange.removed(fieldPath, baseline.get(key)));
            }
        }
        
        for (String key : new TreeSet<>(current.entries().keySet())) {
            if (baseline.containsKey(key)) {
                continue;
            }
            // Provider-assigned fields are expected to appear on the actual side
            if (excludeAddedKey.test(key)) {
                continue;
            }
            changes.add(FieldChange.added(joinPath(path, key), current.get(key)));
        }
    }
    
    /**
     * A key declared as JSON null that gained a value counts as added, so the exclusion applies to it too.
     */
    private static boolean isExcludedAddition(String key, ConfigValue baseline, ConfigValue current,
                                              Predicate<String> excludeAddedKey) {
        return baseline.isNull() && !current.isNull() && excludeAddedKey.test(key);
    }
    
    private void compareSequences(String path, SequenceValue baseline, SequenceValue current,
                                  Predicate<String> excludeAddedKey, List<FieldChange> changes) {
        // Length changes are not aligned element by element
        if (baseline.size() != current.size()) {
            changes.add(FieldChange.modified(path, baseline, current));
            return;
        }
        
        for (int i = 0; i < baseline.size(); i++) {
            compare(path + "[" + i + "]", baseline.get(i), current.get(i), excludeAddedKey, changes);
        }
    }
    
    private static String joinPath(String base, String field) {
        return base.isEmpty() ? field : base + "." + field;
    }
}
