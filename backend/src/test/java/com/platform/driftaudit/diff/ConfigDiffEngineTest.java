package com.platform.driftaudit.diff;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.driftaudit.value.ConfigValue;
import com.platform.driftaudit.value.ConfigValueMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.platform.driftaudit.value.ConfigValue.of;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class ConfigDiffEngineTest {
    
    private ConfigDiffEngine engine;
    private ConfigValueMapper mapper;
    
    @BeforeEach
    void setUp() {
        engine = new ConfigDiffEngine();
        mapper = new ConfigValueMapper(new ObjectMapper());
    }
    
    private ConfigValue json(String document) {
        return mapper.read(document, "test");
    }
    
    private List<FieldChange> diff(String baseline, String current) {
        return engine.diff("", json(baseline), json(current));
    }
    
    @Nested
    @DisplayName("identity and complements")
    class Identity {
        @Test
        void identicalTreesHaveNoChanges() {
            String doc = "{\"a\":{\"b\":[1,{\"c\":\"x\"}],\"d\":null},\"e\":true}";
            assertThat(diff(doc, doc)).isEmpty();
        }
        
        @Test
        void addedKeyIsReportedOnce() {
            List<FieldChange> changes = diff("{\"a\":1}", "{\"a\":1,\"b\":2}");
            
            assertThat(changes).hasSize(1);
            FieldChange change = changes.get(0);
            assertThat(change.path()).isEqualTo("b");
            assertThat(change.kind()).isEqualTo(ChangeKind.ADDED);
            assertThat(change.oldValue()).isNull();
            assertThat(change.newValue()).isEqualTo(of(2));
        }
        
        @Test
        void removedKeyIsReportedOnce() {
            List<FieldChange> changes = diff("{\"a\":1,\"b\":2}", "{\"b\":2}");
            
            assertThat(changes).extracting(FieldChange::path, FieldChange::kind)
                .containsExactly(tuple("a", ChangeKind.REMOVED));
            assertThat(changes.get(0).oldValue()).isEqualTo(of(1));
            assertThat(changes.get(0).newValue()).isNull();
        }
        
        @Test
        void bothAbsentIsNoChange() {
            assertThat(engine.diff("", null, null)).isEmpty();
            assertThat(engine.diff("", ConfigValue.NULL, null)).isEmpty();
        }
    }
    
    @Nested
    @DisplayName("mappings")
    class Mappings {
        @Test
        void nestedScalarChangeUsesDottedPath() {
            List<FieldChange> changes = diff("{\"encryption\":{\"enabled\":true}}", "{\"encryption\":{\"enabled\":false}}");
            
            assertThat(changes).extracting(FieldChange::path, FieldChange::kind)
                .containsExactly(tuple("encryption.enabled", ChangeKind.MODIFIED));
            assertThat(changes.get(0).field()).isEqualTo("enabled");
        }
        
        @Test
        void removedSubtreeIsReportedWhole() {
            List<FieldChange> changes = diff("{\"logging\":{\"bucket\":\"logs\",\"prefix\":\"p\"}}", "{}");
            
            assertThat(changes).hasSize(1);
            assertThat(changes.get(0).path()).isEqualTo("logging");
            assertThat(changes.get(0).oldValue()).isEqualTo(json("{\"bucket\":\"logs\",\"prefix\":\"p\"}"));
        }
        
        @Test
        void outputOrderIsIndependentOfKeyOrder() {
            List<FieldChange> first = diff("{\"z\":1,\"a\":1,\"m\":1}", "{\"q\":2,\"a\":2,\"z\":2}");
            List<FieldChange> second = diff("{\"m\":1,\"z\":1,\"a\":1}", "{\"z\":2,\"a\":2,\"q\":2}");
            
            assertThat(first).isEqualTo(second);
            assertThat(first).extracting(FieldChange::path, FieldChange::kind).containsExactly(
                tuple("a", ChangeKind.MODIFIED),
                tuple("m", ChangeKind.REMOVED),
                tuple("z", ChangeKind.MODIFIED),
                tuple("q", ChangeKind.ADDED)
            );
        }
        
        @Test
        void presentNullBecomingValueIsAnAddition() {
            List<FieldChange> changes = diff("{\"kms_key\":null}", "{\"kms_key\":\"arn:key\"}");
            
            assertThat(changes).extracting(FieldChange::path, FieldChange::kind)
                .containsExactly(tuple("kms_key", ChangeKind.ADDED));
            assertThat(changes.get(0).oldValue()).isEqualTo(ConfigValue.NULL);
        }
        
        @Test
        void valueBecomingNullIsARemoval() {
            List<FieldChange> changes = diff("{\"kms_key\":\"arn:key\"}", "{\"kms_key\":null}");
            
            assertThat(changes).extracting(FieldChange::path, FieldChange::kind)
                .containsExactly(tuple("kms_key", ChangeKind.REMOVED));
        }
        
        @Test
        void rootPathPrefixesEveryChange() {
            List<FieldChange> changes = engine.diff("config", json("{\"a\":1}"), json("{\"a\":2}"));
            assertThat(changes).extracting(FieldChange::path).containsExactly("config.a");
        }
    }
    
    @Nested
    @DisplayName("sequences and shapes")
    class Sequences {
        @Test
        void sameLengthSequencesRecursePerIndex() {
            List<FieldChange> changes = diff(
                "{\"rules\":[{\"port\":22},{\"port\":443}]}",
                "{\"rules\":[{\"port\":22},{\"port\":8443}]}");
            
            assertThat(changes).extracting(FieldChange::path, FieldChange::kind)
                .containsExactly(tuple("rules[1].port", ChangeKind.MODIFIED));
            assertThat(changes.get(0).field()).isEqualTo("port");
        }
        
        @Test
        void lengthChangeReplacesWholeSequence() {
            List<FieldChange> changes = diff("{\"cidrs\":[\"10.0.0.0/8\"]}", "{\"cidrs\":[\"10.0.0.0/8\",\"0.0.0.0/0\"]}");
            
            assertThat(changes).hasSize(1);
            FieldChange change = changes.get(0);
            assertThat(change.path()).isEqualTo("cidrs");
            assertThat(change.kind()).isEqualTo(ChangeKind.MODIFIED);
            assertThat(change.newValue()).isEqualTo(json("[\"10.0.0.0/8\",\"0.0.0.0/0\"]"));
        }
        
        @Test
        void shapeMismatchIsOneModification() {
            List<FieldChange> changes = diff("{\"versioning\":{\"enabled\":true}}", "{\"versioning\":\"Enabled\"}");
            
            assertThat(changes).extracting(FieldChange::path, FieldChange::kind)
                .containsExactly(tuple("versioning", ChangeKind.MODIFIED));
        }
        
        @Test
        void scalarTypeChangeIsAModification() {
            assertThat(diff("{\"port\":22}", "{\"port\":\"22\"}"))
                .extracting(FieldChange::kind).containsExactly(ChangeKind.MODIFIED);
        }
    }
    
    @Nested
    @DisplayName("added-key exclusion")
    class Exclusion {
        @Test
        void excludedAddedKeysAreSkippedAtAnyDepth() {
            List<FieldChange> changes = engine.diff("",
                json("{\"tags\":{\"env\":\"prod\"}}"),
                json("{\"id\":\"i-123\",\"tags\":{\"env\":\"prod\",\"arn\":\"x\"},\"extra\":1}"),
                Set.of("id", "arn")::contains);
            
            assertThat(changes).extracting(FieldChange::path).containsExactly("extra");
        }
        
        @Test
        void excludedKeyDeclaredAsNullIsSkippedWhenItGainsAValue() {
            List<FieldChange> changes = engine.diff("",
                json("{\"id\":null,\"name\":null}"),
                json("{\"id\":\"i-1\",\"name\":\"web\"}"),
                Set.of("id")::contains);
            
            assertThat(changes).extracting(FieldChange::path, FieldChange::kind)
                .containsExactly(tuple("name", ChangeKind.ADDED));
        }
        
        @Test
        void exclusionDoesNotHideRemovalsOrModifications() {
            List<FieldChange> changes = engine.diff("",
                json("{\"id\":\"a\",\"status\":\"up\"}"),
                json("{\"status\":\"down\"}"),
                Set.of("id", "status")::contains);
            
            assertThat(changes).extracting(FieldChange::path, FieldChange::kind).containsExactly(
                tuple("id", ChangeKind.REMOVED),
                tuple("status", ChangeKind.MODIFIED)
            );
        }
    }
    
    @Test
    void changeWithoutEitherSideIsRejected() {
        assertThatThrownBy(() -> new FieldChange("a", null, null, ChangeKind.MODIFIED))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
