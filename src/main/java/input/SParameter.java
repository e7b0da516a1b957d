package main.java.input;

import main.java.util.Cloger;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public class SParameter {

    /**
     * Smoothing parameter, larger values give smoother output
     */
    public static double lambda = 100.0;

    /**
     * Order of the finite differences used as roughness penalty
     */
    public static int order = 2;

    /**
     * LU pivots with absolute value below this are treated as zero and the system as singular.
     * Same default as commons-math3.
     */
    public static double singularity_threshold = 1.0e-11;

    /**
     * Get version
     * @return the version in project.properties, or "unknown"
     */
    public static String getVersion(){
        Properties properties = new Properties();
        try (InputStream in = SParameter.class.getClassLoader().getResourceAsStream("project.properties")) {
            if (in == null) {
                return "unknown";
            }
            properties.load(in);
        } catch (IOException e) {
            Cloger.getInstance().logger.warn("Failed to read project.properties: {}", e.getMessage());
            return "unknown";
        }
        return properties.getProperty("version", "unknown");
    }
}
