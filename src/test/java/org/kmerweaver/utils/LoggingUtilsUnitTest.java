package org.kmerweaver.utils;

import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class LoggingUtilsUnitTest {

    @DataProvider
    public Object[][] levels() {
        return new Object[][]{
                {Log.LogLevel.DEBUG, Level.DEBUG},
                {Log.LogLevel.INFO, Level.INFO},
                {Log.LogLevel.WARNING, Level.WARN},
                {Log.LogLevel.ERROR, Level.ERROR},
        };
    }

    @Test(dataProvider = "levels")
    public void testLevelConversion(final Log.LogLevel htsjdkLevel, final Level log4jLevel) {
        Assert.assertEquals(LoggingUtils.levelToLog4jLevel(htsjdkLevel), log4jLevel);
        Assert.assertEquals(LoggingUtils.levelFromLog4jLevel(log4jLevel), htsjdkLevel);
    }

    @Test
    public void testSetLoggingLevel() {
        try {
            LoggingUtils.setLoggingLevel(Log.LogLevel.DEBUG);
            Assert.assertEquals(Log.getGlobalLogLevel(), Log.LogLevel.DEBUG);
        } finally {
            LoggingUtils.setLoggingLevel(Log.LogLevel.WARNING);
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNullLevel() {
        LoggingUtils.setLoggingLevel(null);
    }
}
