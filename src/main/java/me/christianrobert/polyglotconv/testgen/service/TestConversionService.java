package me.christianrobert.polyglotconv.testgen.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.polyglotconv.config.service.ConfigService;
import me.christianrobert.polyglotconv.testgen.model.ConvertedFile;
import me.christianrobert.polyglotconv.testgen.model.ConvertedItem;
import me.christianrobert.polyglotconv.testgen.model.TestFile;
import me.christianrobert.polyglotconv.transformer.context.ReqlVariables;
import me.christianrobert.polyglotconv.transformer.service.ExpressionConversionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Converts whole test files.
 *
 * <p>Each file is converted end to end before the next one starts; files matching a
 * configured exclusion are left out.</p>
 */
@ApplicationScoped
public class TestConversionService {

    private static final Logger log = LoggerFactory.getLogger(TestConversionService.class);

    @Inject
    ExpressionConversionService expressionService;

    @Inject
    ConfigService configService;

    /**
     * Converts the given test files, skipping excluded ones.
     *
     * @param testFiles Test files in processing order
     * @return Converted files, in the same order, without the excluded ones
     * @throws TestItemShapeException if a file yields an item of unknown shape
     */
    public List<ConvertedFile> convertAll(List<TestFile> testFiles) {
        long start = System.nanoTime();
        List<ConvertedFile> converted = new ArrayList<>();

        for (TestFile testFile : testFiles) {
            if (isExcluded(testFile.getFilename())) {
                log.info("Skipping excluded test file {}", testFile.getFilename());
                continue;
            }
            log.info("Working on {}", testFile.getFilename());
            converted.add(convertFile(testFile));
        }

        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
        log.info("Finished in {} seconds", String.format("%.2f", seconds));
        return converted;
    }

    /**
     * Converts a single test file, excluded or not.
     */
    public ConvertedFile convertFile(TestFile testFile) {
        List<ConvertedItem> items = new ArrayList<>();
        Iterator<ConvertedItem> iterator = convertLazily(testFile);
        while (iterator.hasNext()) {
            items.add(iterator.next());
        }

        ConvertedFile convertedFile = new ConvertedFile(
                testFile.getFilename(),
                testFile.getModuleName(),
                testFile.getDescription(),
                testFile.getTableVariableNames(),
                items);
        log.debug("Converted {}: {} items, {} skipped",
                testFile.getFilename(), items.size(), convertedFile.countSkipped());
        return convertedFile;
    }

    /**
     * Converts the items of a test file one by one as the returned iterator is consumed.
     */
    public Iterator<ConvertedItem> convertLazily(TestFile testFile) {
        ReqlVariables initial = expressionService.initialVariables(testFile.getTableVariableNames());
        TestFileConverter converter = new TestFileConverter(expressionService, testFile.getFilename());
        return converter.convert(testFile.getItems().iterator(), initial);
    }

    /**
     * Whether a test file name contains one of the configured exclusion fragments.
     */
    public boolean isExcluded(String filename) {
        for (String exclusion : configService.getTestExclusions()) {
            if (filename.contains(exclusion)) {
                return true;
            }
        }
        return false;
    }
}
