package edu.washu.tag.extractor.pathosys.util;

import static edu.washu.tag.extractor.pathosys.util.Constants.OPTION_IGNORE_SDPC;
import static edu.washu.tag.extractor.pathosys.util.Constants.OPTION_PATH_TRANSFORMER;

import edu.washu.tag.extractor.pathosys.model.PreprocessOptions;
import java.util.Map;
import org.apache.commons.lang3.BooleanUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * DefaultArgs provides default values for the preprocessing operator options.
 * These defaults can be overridden by option values passed to the operator.
 */
@Component
public class DefaultArgs {

    private final String pathTransformer;
    private final boolean ignoreSdpc;

    /**
     * Constructor for DefaultArgs.
     *
     * @param pathTransformer Default path transform rule. See {@link PreprocessOptions#pathTransformer()}.
     * @param ignoreSdpc      Default for dropping every SDPC slide.
     */
    public DefaultArgs(
        @Value("${scout.pathoSys.pathTransformer:/mnt/ruipath/hospital_data/}") String pathTransformer,
        @Value("${scout.pathoSys.ignoreSdpc:false}") boolean ignoreSdpc
    ) {
        this.pathTransformer = pathTransformer;
        this.ignoreSdpc = ignoreSdpc;
    }

    /**
     * Path transform rule.
     *
     * @param input The input value for the path transform rule.
     * @return The input value or the default if no value was given.
     */
    public String getPathTransformer(Object input) {
        return input == null ? pathTransformer : input.toString();
    }

    /**
     * Whether every SDPC slide is dropped.
     * Accepts booleans and the strings "true", "false", "yes", "no", "on" and "off".
     *
     * @param input The input value for the flag.
     * @return The input value or the default if no value was given.
     */
    public boolean getIgnoreSdpc(Object input) {
        if (input instanceof Boolean value) {
            return value;
        }
        if (input == null || input.toString().isBlank()) {
            return ignoreSdpc;
        }
        Boolean parsed = BooleanUtils.toBooleanObject(input.toString().strip());
        if (parsed == null) {
            throw new IllegalArgumentException("Option '" + OPTION_IGNORE_SDPC + "' must be a boolean, got: " + input);
        }
        return parsed;
    }

    /**
     * Resolves operator options against the defaults.
     *
     * @param options Options passed to the operator. May be null.
     * @return Resolved options
     */
    public PreprocessOptions resolve(Map<String, Object> options) {
        Map<String, Object> values = options == null ? Map.of() : options;
        return new PreprocessOptions(
            getPathTransformer(values.get(OPTION_PATH_TRANSFORMER)),
            getIgnoreSdpc(values.get(OPTION_IGNORE_SDPC))
        );
    }
}
