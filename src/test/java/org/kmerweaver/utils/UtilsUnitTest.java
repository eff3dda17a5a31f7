package org.kmerweaver.utils;

import com.google.common.collect.ImmutableList;
import org.kmerweaver.KmerWeaverBaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Testing framework for general purpose utilities class.
 *
 */
public final class UtilsUnitTest extends KmerWeaverBaseTest {

    @Test
    public void testForceJVMLocaleToUSEnglish() {

        // Set locale to Canada
        Locale.setDefault(Locale.CANADA);

        // Force Locale to US English
        Utils.forceJVMLocaleToUSEnglish();

        // Get the current locale
        Locale l = Locale.getDefault();

        Assert.assertEquals(l, Locale.US);
    }

    @Test
    public void testDupChar() {
        Assert.assertEquals(Utils.dupChar('a', 0), "");
        Assert.assertEquals(Utils.dupChar('a', 1), "a");
        Assert.assertEquals(Utils.dupChar('b', 5), "bbbbb");
    }

    @Test
    public void testWarnUserLines() {
        final List<String> lines = Utils.warnUserLines("message");
        Assert.assertEquals(lines.size(), 6);
        Assert.assertEquals(lines.get(0), Utils.dupChar('*', 80));
        Assert.assertEquals(lines.get(3), "* message");
    }

    @Test
    public void testResetRandomGenerator() {
        Utils.resetRandomGenerator();
        final int first = Utils.getRandomGenerator().nextInt();
        Utils.resetRandomGenerator();
        Assert.assertEquals(Utils.getRandomGenerator().nextInt(), first);
    }

    @Test
    public void testNonNullReturnsInput() {
        final Object o = new Object();
        Assert.assertSame(Utils.nonNull(o), o);
        Assert.assertSame(Utils.nonNull(o, "msg"), o);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNonNullThrows() {
        Utils.nonNull(null, "msg");
    }

    @Test
    public void testNonEmpty() {
        Assert.assertEquals(Utils.nonEmpty("a", "msg"), "a");
        Assert.assertThrows(IllegalArgumentException.class, () -> Utils.nonEmpty("", "msg"));
        Assert.assertThrows(IllegalArgumentException.class, () -> Utils.nonEmpty(null, "msg"));
    }

    @Test
    public void testContainsNoNull() {
        Utils.containsNoNull(ImmutableList.of("a", "b"), "msg");
        Utils.containsNoNull(Collections.emptyList(), "msg");
        Assert.assertThrows(IllegalArgumentException.class, () -> Utils.containsNoNull(Arrays.asList("a", null), "msg"));
    }

    @Test
    public void testValidateArg() {
        Utils.validateArg(true, "msg");
        Utils.validateArg(true, () -> "msg");
        Assert.assertThrows(IllegalArgumentException.class, () -> Utils.validateArg(false, "msg"));
        Assert.assertThrows(IllegalArgumentException.class, () -> Utils.validateArg(false, () -> "msg"));
    }

    @Test
    public void testValidate() {
        Utils.validate(true, "msg");
        Assert.assertThrows(IllegalStateException.class, () -> Utils.validate(false, "msg"));
        Assert.assertThrows(IllegalStateException.class, () -> Utils.validate(false, () -> "msg"));
    }
}
