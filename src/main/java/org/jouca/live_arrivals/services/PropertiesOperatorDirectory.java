package org.jouca.live_arrivals.services;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link OperatorDirectory} read from a classpath properties file, {@code operator_id=name} per line.
 *
 * @author Jouca
 * @since 1.0
 */
public class PropertiesOperatorDirectory implements OperatorDirectory {
    private static final Logger logger = LoggerFactory.getLogger(PropertiesOperatorDirectory.class);

    private final Properties names = new Properties();

    public PropertiesOperatorDirectory(String resource) {
        try (InputStream in = PropertiesOperatorDirectory.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.warn("Operator directory {} not found, operators will have no English name", resource);
                return;
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                names.load(reader);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read operator directory " + resource, e);
        }
        logger.info("Loaded {} operator names", names.size());
    }

    /**
     * Numeric ids are compared as numbers, so {@code 03} and {@code 3} name the same operator.
     */
    @Override
    public String englishName(String operatorId) {
        if (operatorId == null) {
            return null;
        }
        String key = operatorId.strip();
        if (!key.isEmpty() && key.chars().allMatch(Character::isDigit)) {
            key = key.replaceFirst("^0+(?=.)", "");
        }
        return names.getProperty(key);
    }
}
