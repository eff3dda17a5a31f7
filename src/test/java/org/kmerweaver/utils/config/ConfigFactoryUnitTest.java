package org.kmerweaver.utils.config;

import org.kmerweaver.KmerWeaverBaseTest;
import org.kmerweaver.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class ConfigFactoryUnitTest extends KmerWeaverBaseTest {

    @Test
    public void testGetSourcesAnnotationPathVariables() {
        Assert.assertEquals(ConfigFactory.getInstance().getSourcesAnnotationPathVariables(KmerWeaverConfig.class),
                Arrays.asList(KmerWeaverConfig.CONFIG_FILE_VARIABLE_FILE_NAME, KmerWeaverConfig.CONFIG_FILE_VARIABLE_CLASS_PATH));
    }

    @Test
    public void testCheckFileNamePropertyExistenceSetsMissingProperties() {
        final String property = "ConfigFactoryUnitTest.unsetPathVariable";
        ConfigFactory.getInstance().checkFileNamePropertyExistenceAndSetConfigFactoryProperties(Collections.singletonList(property));
        Assert.assertEquals(org.aeonbits.owner.ConfigFactory.getProperty(property), ConfigFactory.NO_PATH_VARIABLE_VALUE);
    }

    @DataProvider(name = "configFileArgs")
    public Object[][] configFileArgs() {
        final String option = "--" + "kmerweaver-config-file";
        return new Object[][]{
                {new String[]{"Tool", "in.txt"}, null},
                {new String[]{"Tool", option, "my.properties", "in.txt"}, "my.properties"},
                {new String[]{option, "other.properties"}, "other.properties"},
        };
    }

    @Test(dataProvider = "configFileArgs")
    public void testGetConfigFilenameFromArgs(final String[] args, final String expected) {
        Assert.assertEquals(ConfigFactory.getConfigFilenameFromArgs(args, "--kmerweaver-config-file"), expected);
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testConfigOptionWithoutFile() {
        ConfigFactory.getConfigFilenameFromArgs(new String[]{"Tool", "--kmerweaver-config-file", "--lenient"}, "--kmerweaver-config-file");
    }

    @Test
    public void testDefaults() {
        final KmerWeaverConfig config = ConfigFactory.getInstance().getKmerWeaverConfig();
        Assert.assertEquals(config.kmer_delimiter(), ",");
        Assert.assertFalse(config.trim_kmer_whitespace());
        Assert.assertFalse(config.kmerweaver_stacktrace_on_user_exception());
    }

    @Test
    public void testCreateConfigFromFile() {
        final File configFile = createTempFileWithContent("kmer_delimiter = ;\ntrim_kmer_whitespace = true\n", "KmerWeaverConfig", ".properties");
        try {
            final KmerWeaverConfig config = ConfigFactory.getInstance().createConfigFromFile(configFile.getAbsolutePath(), KmerWeaverConfig.class);
            Assert.assertEquals(config.kmer_delimiter(), ";");
            Assert.assertTrue(config.trim_kmer_whitespace());
            // merged from the defaults
            Assert.assertFalse(config.kmerweaver_stacktrace_on_user_exception());
        } finally {
            org.aeonbits.owner.ConfigFactory.setProperty(KmerWeaverConfig.CONFIG_FILE_VARIABLE_FILE_NAME, ConfigFactory.NO_PATH_VARIABLE_VALUE);
        }
    }

    @Test
    public void testSystemPropertiesFromConfig() {
        final KmerWeaverConfig config = ConfigFactory.getInstance().create(KmerWeaverConfig.class);
        final LinkedHashMap<String, String> properties = ConfigFactory.getSystemPropertiesFromConfig(config);
        Assert.assertEquals(properties.size(), 1);
        Assert.assertEquals(properties.get("kmerweaver_stacktrace_on_user_exception"), "false");

        final Map<String, Object> all = ConfigFactory.getConfigMap(config, false);
        Assert.assertEquals(all.get("kmer_delimiter"), ",");
        Assert.assertTrue(all.containsKey("trim_kmer_whitespace"));
    }

    @Test
    public void testInjectToSystemPropertiesDoesNotOverride() {
        final String key = "ConfigFactoryUnitTest.injected";
        try {
            System.setProperty(key, "original");
            ConfigFactory.getInstance().injectToSystemProperties(Collections.singletonMap(key, "replacement"));
            Assert.assertEquals(System.getProperty(key), "original");

            System.clearProperty(key);
            ConfigFactory.getInstance().injectToSystemProperties(Collections.singletonMap(key, "replacement"));
            Assert.assertEquals(System.getProperty(key), "replacement");
        } finally {
            System.clearProperty(key);
        }
    }
}
