package io.github.yok.itgluemigrate.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link FieldInferrer}.
 */
class FieldInferrerTest {

    private final FieldInferrer inferrer = new FieldInferrer();

    @Test
    void columnNameToKey_正常ケース_区切り文字と記号が正規化されること() {
        assertEquals("serial_number_tag", FieldInferrer.columnNameToKey("Serial Number / Tag"));
        assertEquals("ip_address", FieldInferrer.columnNameToKey("  IP-Address  "));
        assertEquals("cost", FieldInferrer.columnNameToKey("Cost ($)"));
        assertEquals("field", FieldInferrer.columnNameToKey("!!!"));
    }

    @Test
    void inferFieldType_正常ケース_カラム名がパスワードなら値より優先されること() {
        assertEquals(FieldType.PASSWORD, inferrer.inferFieldType("API Key", List.of("1", "2")));
        assertEquals(FieldType.TOTP, inferrer.inferFieldType("MFA Seed", List.of("ABC")));
    }

    @Test
    void inferFieldType_正常ケース_値から型が推論されること() {
        assertEquals(FieldType.CHECKBOX,
                inferrer.inferFieldType("Enabled", List.of("Yes", "no", "TRUE")));
        assertEquals(FieldType.NUMBER, inferrer.inferFieldType("Port", List.of("443", "8080.5")));
        assertEquals(FieldType.DATE,
                inferrer.inferFieldType("Expires", List.of("2024-01-01", "12/31/2025")));
        assertEquals(FieldType.TEXT, inferrer.inferFieldType("Notes", Arrays.asList(null, " ")));
    }

    @Test
    void inferFieldType_正常ケース_繰り返しの多い少数値はselectになること() {
        List<String> values = List.of("Active", "Active", "Retired", "Active", "Retired",
                "Pending");
        assertEquals(FieldType.SELECT, inferrer.inferFieldType("Status", values));
    }

    @Test
    void inferFieldType_正常ケース_ユニークな値はselectにならないこと() {
        assertEquals(FieldType.TEXT,
                inferrer.inferFieldType("Host", List.of("a.example", "b.example", "c.example")));
    }

    @Test
    void inferFieldType_正常ケース_長文が半数以上ならtextboxになること() {
        String longText = "x".repeat(300);
        assertEquals(FieldType.TEXTBOX,
                inferrer.inferFieldType("Description", List.of(longText, "line1\nline2", "s")));
    }

    @Test
    void inferSchema_正常ケース_必須判定と一覧表示とサンプルが設定されること() {
        Map<String, String> row1 = new HashMap<>();
        row1.put("id", "1");
        row1.put("Name", "alpha");
        row1.put("Status", "Active");
        row1.put("Port", "80");
        row1.put("Notes", null);
        Map<String, String> row2 = new HashMap<>();
        row2.put("id", "2");
        row2.put("Name", "beta");
        row2.put("Status", "Active");
        row2.put("Port", "443");
        row2.put("Notes", "n");

        List<FieldDefinition> defs = inferrer.inferSchema(
                List.of("id", "Name", "Status", "Port", "Notes"), List.of(row1, row2),
                Set.of("id"));

        assertEquals(4, defs.size());
        assertEquals("name", defs.get(0).getKey());
        assertTrue(defs.get(0).isRequired());
        assertEquals(List.of("alpha", "beta"), defs.get(0).getSampleValues());
        assertEquals(FieldType.SELECT, defs.get(1).getFieldType());
        assertEquals(List.of("Active"), defs.get(1).getOptions());
        assertNull(defs.get(2).getOptions());
        // 先頭3件のみ一覧表示
        assertTrue(defs.get(2).isShowInList());
        assertFalse(defs.get(3).isShowInList());
        assertFalse(defs.get(3).isRequired());
    }

    @Test
    void inferSchema_正常ケース_行が無ければ必須にならないこと() {
        List<FieldDefinition> defs = inferrer.inferSchema(List.of("Name"), List.of(), Set.of());

        assertEquals(1, defs.size());
        assertFalse(defs.get(0).isRequired());
        assertEquals(FieldType.TEXT, defs.get(0).getFieldType());
    }
}
