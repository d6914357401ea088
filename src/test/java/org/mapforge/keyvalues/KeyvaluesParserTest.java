package org.mapforge.keyvalues;

import org.mapforge.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class KeyvaluesParserTest {

    @Test
    @DisplayName("Parses nested blocks, quoted and bare strings, and comments")
    void parsesNestedBlocks() throws Exception {
        Keyvalues root = KeyvaluesParser.parse("""
                // rule set
                "Conditions"
                {
                    Priority 5
                    "Result" { "setInstVar" "$a 1" } // trailing
                }
                """, "test.cfg");

        Keyvalues conditions = root.findBlock("conditions");
        assertThat(conditions.realName()).isEqualTo("Conditions");
        assertThat(conditions.get("priority")).isEqualTo("5");
        Keyvalues result = conditions.findBlock("result");
        assertThat(result.isBlock()).isTrue();
        assertThat(result.get("SETINSTVAR")).isEqualTo("$a 1");
    }

    @Test
    @DisplayName("Later keys override earlier ones but all are kept in order")
    void duplicateKeysKeepOrder() throws Exception {
        Keyvalues root = KeyvaluesParser.parse("\"a\" \"1\" \"b\" \"2\" \"A\" \"3\"", "dup.cfg");

        assertThat(root.get("a")).isEqualTo("3");
        assertThat(root.findAll("a")).extracting(Keyvalues::value).containsExactly("1", "3");
        assertThat(root.children()).extracting(Keyvalues::realName).containsExactly("a", "b", "A");
    }

    @Test
    @DisplayName("Escapes survive a write and re-parse")
    void escapesSurviveWriting() throws Exception {
        Keyvalues root = Keyvalues.root().append(Keyvalues.block("outer",
                Keyvalues.leaf("path", "instances\\a.vmf"),
                Keyvalues.leaf("quote", "say \"hi\"")));

        Keyvalues reparsed = KeyvaluesParser.parse(KeyvaluesWriter.toText(root), "written.cfg");

        assertThat(reparsed.findBlock("outer").get("path")).isEqualTo("instances\\a.vmf");
        assertThat(reparsed.findBlock("outer").get("quote")).isEqualTo("say \"hi\"");
    }

    @Test
    @DisplayName("Reports every syntax error with file and line")
    void reportsErrors() {
        assertThatThrownBy(() -> KeyvaluesParser.parse("\"a\"\n{\n\"b\" \"1\"\n}\n}\n\"dangling\"", "bad.cfg"))
                .isInstanceOf(KeyvaluesSyntaxException.class)
                .hasMessageContaining("bad.cfg:5")
                .hasMessageContaining("Unexpected '}'")
                .hasMessageContaining("Key 'dangling' has no value");
    }

    @Test
    @DisplayName("Unclosed blocks are an error")
    void unclosedBlock() {
        assertThatThrownBy(() -> KeyvaluesParser.parse("\"a\" { \"b\" \"1\"", "open.cfg"))
                .isInstanceOf(KeyvaluesSyntaxException.class)
                .hasMessageContaining("never closed");
    }

    @Test
    @DisplayName("Typed getters fall back to defaults")
    void typedGetters() {
        Keyvalues kv = Keyvalues.block("x",
                Keyvalues.leaf("int", "12"),
                Keyvalues.leaf("float", "2.5"),
                Keyvalues.leaf("bool", "Yes"),
                Keyvalues.leaf("junk", "abc"),
                Keyvalues.block("sub"));

        assertThat(kv.getInt("int", 0)).isEqualTo(12);
        assertThat(kv.getInt("float", 0)).isEqualTo(2);
        assertThat(kv.getDouble("float", 0)).isEqualTo(2.5);
        assertThat(kv.getBool("bool", false)).isTrue();
        assertThat(kv.getInt("junk", 7)).isEqualTo(7);
        assertThat(kv.getBool("junk", true)).isTrue();
        assertThat(kv.get("sub", "def")).isEqualTo("def");
        assertThat(kv.findBlock("missing").children()).isEmpty();
        assertThat(Keyvalues.leaf("leaf", "v").children()).isEmpty();
    }
}
