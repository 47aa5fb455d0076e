package com.platform.driftaudit.rules;

import com.platform.driftaudit.diff.FieldChange;
import com.platform.driftaudit.value.ConfigValue;
import com.platform.driftaudit.value.ConfigValue.BoolValue;
import com.platform.driftaudit.value.ConfigValue.SequenceValue;
import com.platform.driftaudit.value.ConfigValue.StringValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Security conditions over a single field change.
 * 
 * Each condition understands both boolean flags and their string spellings
 * ("enabled"/"disabled", "AES256"/"none", ...). String comparisons ignore case.
 */
public final class ChangePredicates {
    
    private static final List<String> WORLD_CIDRS = List.of("0.0.0.0/0", "::/0");
    private static final Set<String> CATCH_ALL_TOKENS = Set.of("any", "all");
    private static final List<String> ESCALATION_MARKERS = List.of("*", "admin", "full");
    private static final Set<String> DISABLED_SPELLINGS = Set.of("disabled", "none", "false");
    
    private ChangePredicates() {
    }
    
    /**
     * Encryption switched off: true to false, a removed true flag, or a string setting collapsing to
     * "disabled"/"none".
     */
    public static final ChangePredicate ENCRYPTION_DISABLED = change -> {
        if (change.isAdded()) {
            return false;
        }
        if (turnedOff(change)) {
            return true;
        }
        if (change.isRemoved() && isTrue(change.oldValue())) {
            return true;
        }
        String oldStr = lowerString(change.oldValue());
        String newStr = lowerString(change.newValue());
        if (oldStr == null || newStr == null) {
            return false;
        }
        return (oldStr.equals("enabled") && newStr.equals("disabled"))
            || (oldStr.equals("aes256") && newStr.equals("none"))
            || (oldStr.contains("encrypt") && newStr.equals("none"));
    };
    
    /**
     * Public access switched on: a true flag that was absent or false, or a new value mentioning "public".
     */
    public static final ChangePredicate PUBLIC_ACCESS_ENABLED = change -> {
        if (change.isRemoved()) {
            return false;
        }
        if (isTrue(change.newValue()) && !isTrue(change.oldValue())) {
            return true;
        }
        String newStr = lowerString(change.newValue());
        return newStr != null && newStr.contains("public");
    };
    
    /**
     * A block-public-access flag (block_public_acls, BlockPublicPolicy, ...) turned from true to false.
     */
    public static final ChangePredicate BLOCK_PUBLIC_DISABLED = change ->
        compactPath(change).contains("blockpublic") && turnedOff(change);
    
    public static final ChangePredicate ACL_MADE_PUBLIC = PUBLIC_ACCESS_ENABLED.or(BLOCK_PUBLIC_DISABLED);
    
    /**
     * New value, or any string element of a new list, opens the rule to every address.
     */
    public static final ChangePredicate SECURITY_GROUP_OPENED = change -> {
        if (change.isRemoved()) {
            return false;
        }
        return newStrings(change).stream().anyMatch(ChangePredicates::containsWorldCidr);
    };
    
    /**
     * Like {@link #SECURITY_GROUP_OPENED}, also accepting catch-all tokens such as "any" or "all".
     */
    public static final ChangePredicate FIREWALL_OPENED = change -> {
        if (change.isRemoved()) {
            return false;
        }
        return newStrings(change).stream()
            .anyMatch(s -> containsWorldCidr(s) || hasCatchAllToken(s));
    };
    
    /**
     * New grant contains a wildcard, "admin" or "full".
     */
    public static final ChangePredicate PERMISSION_ESCALATION = change -> {
        if (change.isRemoved()) {
            return false;
        }
        return newStrings(change).stream()
            .map(s -> s.toLowerCase(Locale.ROOT))
            .anyMatch(s -> ESCALATION_MARKERS.stream().anyMatch(s::contains));
    };
    
    public static final ChangePredicate POLICY_CHANGED = change ->
        lowerPath(change).contains("policy") && (change.isModified() || change.isRemoved());
    
    public static final ChangePredicate BACKUP_DISABLED = disabledUnder("backup");
    
    public static final ChangePredicate LOGGING_DISABLED = disabledUnder("log");
    
    public static final ChangePredicate MONITORING_DISABLED = disabledUnder("monitor");
    
    /**
     * Catch-all for fields where any modification or removal matters.
     */
    public static final ChangePredicate VALUE_CHANGED = change -> change.isModified() || change.isRemoved();
    
    /**
     * A feature under {@code pathKeyword} switched off, as a flag or as a "disabled"/"none"/"false" string.
     */
    public static ChangePredicate disabledUnder(String pathKeyword) {
        String keyword = pathKeyword.toLowerCase(Locale.ROOT);
        return change -> {
            if (!lowerPath(change).contains(keyword)) {
                return false;
            }
            if (turnedOff(change)) {
                return true;
            }
            String newStr = lowerString(change.newValue());
            return newStr != null && DISABLED_SPELLINGS.contains(newStr);
        };
    }
    
    // ==================== helpers ====================
    
    private static boolean turnedOff(FieldChange change) {
        return change.oldValue() instanceof BoolValue oldFlag && oldFlag.value()
            && change.newValue() instanceof BoolValue newFlag && !newFlag.value();
    }
    
    private static boolean isTrue(ConfigValue value) {
        return value instanceof BoolValue flag && flag.value();
    }
    
    private static String lowerString(ConfigValue value) {
        return value instanceof StringValue s ? s.value().toLowerCase(Locale.ROOT) : null;
    }
    
    private static String lowerPath(FieldChange change) {
        return change.path().toLowerCase(Locale.ROOT);
    }
    
    private static String compactPath(FieldChange change) {
        return lowerPath(change).replace("_", "").replace("-", "");
    }
    
    /**
     * The new value if it is a string, or the string elements of a new list.
     */
    private static List<String> newStrings(FieldChange change) {
        ConfigValue value = change.newValue();
        if (value instanceof StringValue s) {
            return List.of(s.value());
        }
        List<String> strings = new ArrayList<>();
        if (value instanceof SequenceValue seq) {
            for (ConfigValue element : seq.elements()) {
                if (element instanceof StringValue s) {
                    strings.add(s.value());
                }
            }
        }
        return strings;
    }
    
    private static boolean containsWorldCidr(String value) {
        return WORLD_CIDRS.stream().anyMatch(value::contains);
    }
    
    private static boolean hasCatchAllToken(String value) {
        return Arrays.stream(value.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
            .anyMatch(CATCH_ALL_TOKENS::contains);
    }
}
