package se.kth.hayroll.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import picocli.CommandLine.IVersionProvider;

/** Provides the CLI with the version recorded by Maven at packaging time. */
public class HayrollVersionProvider implements IVersionProvider {
    private static final String POM_PROPERTIES = "META-INF/maven/se.kth/hayroll/pom.properties";

    @Override
    public String[] getVersion() {
        return new String[] {"hayroll " + getVersionFromPomProperties()};
    }

    private String getVersionFromPomProperties() {
        Properties props = new Properties();
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(POM_PROPERTIES)) {
            if (in == null) {
                return "LOCAL";
            }
            props.load(in);
            return props.getProperty("version", "LOCAL");
        } catch (IOException e) {
            return "LOCAL";
        }
    }
}
