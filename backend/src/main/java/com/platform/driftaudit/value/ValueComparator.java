package com.platform.driftaudit.value;

import com.platform.driftaudit.value.ConfigValue.BoolValue;
import com.platform.driftaudit.value.ConfigValue.MappingValue;
import com.platform.driftaudit.value.ConfigValue.NullValue;
import com.platform.driftaudit.value.ConfigValue.NumberValue;
import com.platform.driftaudit.value.ConfigValue.SequenceValue;
import com.platform.driftaudit.value.ConfigValue.StringValue;

import java.util.Map;

/**
 * Strict deep equality over configuration trees.
 * 
 * A Java {@code null} stands for an absent value. Scalars never match across variants:
 * the number {@code 1} and the string {@code "1"} are different values.
 */
public final class ValueComparator {
    
    private ValueComparator() {
    }
    
    public static boolean equal(ConfigValue a, ConfigValue b) {
        if (a == null || b == null) {
            return a == b;
        }
        
        if (a instanceof NullValue) {
            return b instanceof NullValue;
        }
        if (a instanceof BoolValue ab) {
            return b instanceof BoolValue bb && ab.value() == bb.value();
        }
        if (a instanceof NumberValue an) {
            return b instanceof NumberValue bn && an.value().compareTo(bn.value()) == 0;
        }
        if (a instanceof StringValue as) {
            return b instanceof StringValue bs && as.value().equals(bs.value());
        }
        if (a instanceof SequenceValue aseq) {
            return b instanceof SequenceValue bseq && sequencesEqual(aseq, bseq);
        }
        if (a instanceof MappingValue amap) {
            return b instanceof MappingValue bmap && mappingsEqual(amap, bmap);
        }
        throw new IllegalStateException("Unhandled config value variant: " + a.getClass().getName());
    }
    
    private static boolean sequencesEqual(SequenceValue a, SequenceValue b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!equal(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }
    
    private static boolean mappingsEqual(MappingValue a, MappingValue b) {
        if (a.entries().size() != b.entries().size()) {
            return false;
        }
        for (Map.Entry<String, ConfigValue> entry : a.entries().entrySet()) {
            if (!b.containsKey(entry.getKey()) || !equal(entry.getValue(), b.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }
}
