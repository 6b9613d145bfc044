package com.sqconfig.dispatch.cli;

import com.sqconfig.core.error.ErrorCode;
import com.sqconfig.core.error.SqConfigException;
import com.sqconfig.core.model.ObjectType;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Object types named by a {@code --what} option.
 *
 * @param explicit true when the user listed the types; unsupported types then
 *                 fail the command instead of being skipped
 */
record ObjectTypeSelection(Set<ObjectType> types, boolean explicit) {

    /**
     * @param what comma separated section names, null or blank for every type
     */
    static ObjectTypeSelection parse(String what) {
        if (what == null || what.isBlank()) {
            return new ObjectTypeSelection(EnumSet.allOf(ObjectType.class), false);
        }
        var types = EnumSet.noneOf(ObjectType.class);
        for (var name : what.split(",")) {
            if (name.isBlank()) {
                continue;
            }
            types.add(ObjectType.fromSection(name).orElseThrow(() -> new SqConfigException(ErrorCode.ARGS_ERROR,
                    "Unknown object type '%s', expected one of %s".formatted(name.trim(), validNames()))));
        }
        return new ObjectTypeSelection(types, true);
    }

    private static String validNames() {
        return Arrays.stream(ObjectType.values()).map(ObjectType::section).collect(Collectors.joining(", "));
    }
}
