package infra.hwpx;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HwpxCellRoleClassifierTest {

    private final HwpxCellRoleClassifier classifier = new HwpxCellRoleClassifier();

    @Test
    void titles_and_known_labels_are_headers() {
        assertTrue(classifier.isHeader("1. 신상정보", 0));
        assertTrue(classifier.isHeader("개인이력카드", 0));
        assertTrue(classifier.isHeader("성명", 10));
        assertTrue(classifier.isHeader("성   명", 0));
        assertTrue(classifier.isHeader("취 업 처", 0));
    }

    @Test
    void value_shaped_text_is_data_even_on_header_fill() {
        assertFalse(classifier.isHeader("hong@example.com", 9));
        assertFalse(classifier.isHeader("010-1234-5678", 9));
        assertFalse(classifier.isHeader("010 1234 5678", 0));
        assertFalse(classifier.isHeader("1990-03-05", 0));
        assertFalse(classifier.isHeader("홍길동", 8));
    }

    @Test
    void blank_and_dash_are_data() {
        assertFalse(classifier.isHeader("", 9));
        assertFalse(classifier.isHeader(null, 0));
        assertFalse(classifier.isHeader("-", 11));
    }

    @Test
    void fill_decides_unknown_text_before_length() {
        assertTrue(classifier.isHeader("Expert Talk Session", 11));
        assertFalse(classifier.isHeader("Note", 10));
        assertTrue(classifier.isHeader("Note", 0));
        assertFalse(classifier.isHeader("A long free text", 0));
    }

    @Test
    void custom_label_set_replaces_defaults() {
        HwpxCellRoleClassifier custom = new HwpxCellRoleClassifier(List.of("비고란"), Set.of("이력서"));

        assertTrue(custom.isHeader("비 고 란", 10));
        assertTrue(custom.isHeader("이력서", 10));
        assertFalse(custom.isHeader("성명", 10));
    }
}
