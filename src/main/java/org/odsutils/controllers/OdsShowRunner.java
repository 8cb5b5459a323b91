package org.odsutils.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.odsutils.models.OdsRecord;
import org.odsutils.service.OdsEngine;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry: {@code --show=<ods file>} reports an ODS file, {@code --defaults=<file|$name>}
 * shows a defaults set, and {@code --defaults} alone lists the bundled defaults files.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OdsShowRunner implements ApplicationRunner {

    static final String SHOW = "show";
    static final String DEFAULTS = "defaults";
    private static final String BUNDLED_DEFAULTS_PATTERN = "classpath*:defaults/*.json";

    private final OdsEngine odsEngine;

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption(SHOW)) {
            for (String file : args.getOptionValues(SHOW)) {
                show(file);
            }
        }
        if (args.containsOption(DEFAULTS)) {
            List<String> requested = args.getOptionValues(DEFAULTS);
            if (CollectionUtils.isEmpty(requested) || !StringUtils.hasText(requested.get(0))) {
                listBundledDefaults();
            } else {
                requested.forEach(this::showDefaults);
            }
        }
    }

    void show(String file) {
        String working = odsEngine.getWorkingInstanceName();
        odsEngine.createInstance(working, true, true);
        if (!odsEngine.readOds(file, working)) {
            return;
        }
        odsEngine.getInstance(working).ifPresent(instance -> {
            List<OdsRecord> records = instance.getRecords();
            for (int i = 0; i < records.size(); i++) {
                log.info("{}: {}", i, records.get(i));
            }
            if (instance.hasTimeSpan()) {
                log.info("Spanning {} to {}", instance.getEarliest(), instance.getLatest());
            }
        });
        odsEngine.coverage(working);
    }

    void showDefaults(String source) {
        if (odsEngine.loadDefaults(source)) {
            log.info("{}", source);
            odsEngine.getDefaults().forEach((key, value) -> log.info("\t{}: {}", key, value));
        }
    }

    List<String> listBundledDefaults() {
        List<String> names = new ArrayList<>();
        try {
            for (Resource resource : new PathMatchingResourcePatternResolver().getResources(BUNDLED_DEFAULTS_PATTERN)) {
                names.add(resource.getFilename());
            }
        } catch (IOException ioException) {
            log.error("Failed to list bundled defaults files: {}", ioException.getMessage());
            return names;
        }
        log.info("Available system defaults files:");
        names.forEach(name -> log.info("\t{}", name));
        log.info("To view, use --defaults=$<name without .json>");
        return names;
    }
}
