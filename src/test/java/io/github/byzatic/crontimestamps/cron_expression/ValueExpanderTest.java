package io.github.byzatic.crontimestamps.cron_expression;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValueExpanderTest {

    @Test
    void expandsRangeWithStepFromRangeStart() {
        FieldSubentry s = new FieldSubentry(5, 29, 2, "5-29/2");
        ImmutableSet<Integer> v = ValueExpander.expand(s, FieldKind.MINUTE);
        assertEquals(13, v.size());
        assertTrue(v.contains(5));
        assertTrue(v.contains(29));
        assertFalse(v.contains(6));
    }

    @Test
    void stepLargerThanRangeKeepsOnlyStart() {
        FieldSubentry s = new FieldSubentry(7, 7, 2, "7-7/2");
        assertEquals(ImmutableSet.of(7), ValueExpander.expand(s, FieldKind.MONTH));
    }

    @Test
    void fieldValuesAreUnionOfSubentries() {
        MatchedValues v = ValueExpander.expandField(ImmutableList.of(
                new FieldSubentry(1, 5, 2, "1-5/2"),
                new FieldSubentry(6, 10, 2, "6-10/2"),
                new FieldSubentry(59, 59, 1, "59")), FieldKind.MINUTE);
        assertArrayEquals(new int[]{1, 3, 5, 6, 8, 10, 59}, v.toArray());
        assertEquals(7, v.size());
        assertFalse(v.isFull());
    }

    @Test
    void fullDomainIsDetected() {
        MatchedValues v = ValueExpander.expandField(
                ImmutableList.of(new FieldSubentry(0, 6, 1, "0-6")), FieldKind.DAY_OF_WEEK);
        assertTrue(v.isFull());
        assertFalse(v.isEmpty());
    }

    @Test
    void upToDropsValuesPastLimit() {
        MatchedValues dom = ValueExpander.expandField(
                ImmutableList.of(new FieldSubentry(28, 31, 1, "28-31")), FieldKind.DAY_OF_MONTH);
        assertEquals(ImmutableSet.of(28, 29), dom.upTo(29).asSet());
        assertSame(dom, dom.upTo(31));
        assertTrue(dom.upTo(27).isEmpty());
    }

    @Test
    void subentryRejectsBrokenInvariants() {
        assertThrows(IllegalArgumentException.class, () -> new FieldSubentry(5, 1, 1, "5-1"));
        assertThrows(IllegalArgumentException.class, () -> new FieldSubentry(1, 5, 0, "1-5/0"));
    }
}
