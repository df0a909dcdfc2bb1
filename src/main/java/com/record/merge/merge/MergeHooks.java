package com.record.merge.merge;

import com.record.merge.core.model.RecordType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Registry of merge hooks by record type. Types without a hook get {@link MergeHook#NONE}.
 */
public class MergeHooks {

    private final Map<RecordType, MergeHook> hooks = new EnumMap<>(RecordType.class);

    public static MergeHooks none() {
        return new MergeHooks();
    }

    public MergeHooks register(RecordType type, MergeHook hook) {
        hooks.put(Objects.requireNonNull(type, "type is required"), Objects.requireNonNull(hook, "hook is required"));
        return this;
    }

    public MergeHook forType(RecordType type) {
        return hooks.getOrDefault(type, MergeHook.NONE);
    }
}
