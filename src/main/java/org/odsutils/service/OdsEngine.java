package org.odsutils.service;

import lombok.extern.slf4j.Slf4j;
import org.odsutils.models.CoverageReport;
import org.odsutils.models.OdsRecord;
import org.odsutils.models.RecordUpdate;
import org.odsutils.models.TabularReadOptions;
import org.odsutils.models.TimeWindow;
import org.odsutils.models.enums.AdjustSide;
import org.odsutils.models.enums.CullMode;
import org.odsutils.models.enums.CullOption;
import org.odsutils.models.input.RecordInput;
import org.odsutils.models.standard.Standard;
import org.odsutils.service.check.OdsCheck;
import org.odsutils.service.instance.OdsInstance;
import org.odsutils.service.instance.RecordNormalizer;
import org.odsutils.service.io.OdsFileService;
import org.odsutils.service.io.TabularFileService;
import org.odsutils.utils.DateInterpreter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of named ODS instances and the operations that add to, merge, cull and export them.
 * Operations without an explicit instance name act on the working instance. Unknown instance names
 * are logged and turn the call into a no-op; nothing here throws for bad references or bad records.
 * <p>
 * Not thread-safe: one caller owns an engine at a time.
 */
@Slf4j
@Service
public class OdsEngine {

    public static final String DEFAULT_WORKING_INSTANCE = "primary";
    public static final String FROM_ODS = "from_ods";
    public static final Set<CullOption> DEFAULT_CULL = Collections.unmodifiableSet(EnumSet.of(CullOption.TIME, CullOption.DUPLICATE));

    static final String INSTANCE_TO_ADD = "instance_to_add";
    static final String INSTANCE_TO_UPDATE = "instance_to_update";
    static final String CHECK_ACTIVE = "check_active";
    static final String FROM_WEB = "from_web";
    static final String FROM_LOG = "from_log";
    private static final String BUNDLED_DEFAULTS = "defaults/%s.json";

    private final Standard standard;
    private final DateInterpreter dateInterpreter;
    private final OdsFileService odsFileService;
    private final TabularFileService tabularFileService;
    private final OdsCheck odsCheck;
    private final String onlineUrl;
    private final String exportSeparator;

    private final Map<String, OdsInstance> instances = new LinkedHashMap<>();
    private Map<String, Object> defaults = new LinkedHashMap<>();
    private String workingInstance;

    public OdsEngine(Standard standard,
                     DateInterpreter dateInterpreter,
                     OdsFileService odsFileService,
                     TabularFileService tabularFileService,
                     OdsCheck odsCheck,
                     @Value("${ods.working-instance:" + DEFAULT_WORKING_INSTANCE + "}") String workingInstance,
                     @Value("${ods.online-url:}") String onlineUrl,
                     @Value("${ods.export.separator:,}") String exportSeparator) {
        this.standard = standard;
        this.dateInterpreter = dateInterpreter;
        this.odsFileService = odsFileService;
        this.tabularFileService = tabularFileService;
        this.odsCheck = odsCheck;
        this.onlineUrl = onlineUrl;
        this.exportSeparator = exportSeparator;
        String initial = StringUtils.hasText(workingInstance) ? workingInstance : DEFAULT_WORKING_INSTANCE;
        createInstance(initial, true, true);
    }

    // ------------------------------------------------------------------ registry

    public boolean createInstance(String name) {
        return createInstance(name, false, false);
    }

    /**
     * Creates an empty instance. An existing instance is only replaced when {@code overwrite} is set.
     */
    public boolean createInstance(String name, boolean overwrite, boolean setAsWorking) {
        if (!StringUtils.hasText(name)) {
            log.warn("ODS instance name must not be blank");
            return false;
        }
        if (instances.containsKey(name) && !overwrite) {
            log.warn("ODS instance {} already exists -- not overwriting", name);
            return false;
        }
        instances.put(name, new OdsInstance(name, new RecordNormalizer(standard, dateInterpreter)));
        if (setAsWorking) {
            setWorkingInstance(name);
        }
        return true;
    }

    public boolean setWorkingInstance(String name) {
        if (!instances.containsKey(name)) {
            log.warn("ODS instance {} does not exist.", name);
            return false;
        }
        workingInstance = name;
        log.info("The ODS working instance is {}", workingInstance);
        return true;
    }

    public boolean removeInstance(String name) {
        if (name == null || name.equals(workingInstance)) {
            log.warn("Cannot remove the working instance {}", workingInstance);
            return false;
        }
        return instances.remove(name) != null;
    }

    public String getWorkingInstanceName() {
        return workingInstance;
    }

    public Set<String> getInstanceNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(instances.keySet()));
    }

    public Optional<OdsInstance> getInstance(String name) {
        return resolve(name);
    }

    public Standard getStandard() {
        return standard;
    }

    private Optional<OdsInstance> resolve(String name) {
        String resolved = name == null ? workingInstance : name;
        OdsInstance instance = instances.get(resolved);
        if (instance == null) {
            log.error("{} does not exist -- try making it with createInstance or providing a different instance name.", resolved);
        }
        return Optional.ofNullable(instance);
    }

    // ------------------------------------------------------------------ defaults

    public Map<String, Object> getDefaults() {
        return Collections.unmodifiableMap(defaults);
    }

    public void setDefaults(Map<String, ?> values) {
        defaults = values == null ? new LinkedHashMap<>() : new LinkedHashMap<>(values);
        logDefaults("input map");
    }

    /**
     * Loads defaults from {@code from_ods} (single-valued fields of the working instance),
     * {@code $name} (bundled defaults file), or a JSON file, optionally {@code file.json:key} to use a
     * nested object.
     *
     * @return false if the defaults were left unchanged
     */
    public boolean loadDefaults(String source) {
        if (!StringUtils.hasText(source)) {
            return false;
        }
        try {
            if (source.startsWith("$")) {
                defaults = new LinkedHashMap<>(odsFileService.readClasspathObject(String.format(BUNDLED_DEFAULTS, source.substring(1))));
            } else if (source.contains(".json")) {
                String[] fileAndKey = source.split(":", 2);
                Map<String, Object> loaded = odsFileService.readJsonObject(fileAndKey[0]);
                if (fileAndKey.length == 2) {
                    Object nested = loaded.get(fileAndKey[1]);
                    if (!(nested instanceof Map<?, ?> nestedMap)) {
                        log.warn("No defaults object '{}' in {}", fileAndKey[1], fileAndKey[0]);
                        return false;
                    }
                    loaded = new LinkedHashMap<>();
                    for (Map.Entry<?, ?> entry : nestedMap.entrySet()) {
                        loaded.put(String.valueOf(entry.getKey()), entry.getValue());
                    }
                }
                defaults = new LinkedHashMap<>(loaded);
            } else if (FROM_ODS.equals(source)) {
                Optional<OdsInstance> working = resolve(null);
                if (working.isEmpty()) {
                    return false;
                }
                defaults = new LinkedHashMap<>(working.get().singleValuedFields());
            } else {
                log.warn("Not valid default case: {}", source);
                return false;
            }
        } catch (IllegalStateException | IllegalArgumentException exception) {
            log.error("Failed to load defaults from {}: {}", source, exception.getMessage());
            return false;
        }
        logDefaults(source);
        return true;
    }

    private void logDefaults(String source) {
        log.info("Default values from {}:", source);
        defaults.forEach((key, value) -> log.info("\t{}  {}", String.format("%-26s", key), value));
    }

    // ------------------------------------------------------------------ add

    public int addRecord(Map<String, ?> fields, String instanceName) {
        return add(RecordInput.of(fields), instanceName, false);
    }

    /**
     * Normalizes and appends every record of the input, then optionally removes duplicates.
     * Metadata is recomputed once for the whole batch.
     *
     * @return number of records appended
     */
    public int add(RecordInput input, String instanceName, boolean removeDuplicates) {
        Optional<OdsInstance> target = resolve(instanceName);
        if (target.isEmpty()) {
            return 0;
        }
        Optional<List<Map<String, Object>>> entries = resolveEntries(input);
        if (entries.isEmpty()) {
            return 0;
        }
        return appendEntries(target.get(), entries.get(), input.describe(), removeDuplicates);
    }

    public int addFromFile(Path dataFile, TabularReadOptions options, String instanceName, boolean removeDuplicates) {
        Optional<OdsInstance> target = resolve(instanceName);
        if (target.isEmpty()) {
            return 0;
        }
        List<Map<String, Object>> rows;
        try {
            rows = tabularFileService.read(dataFile, options);
        } catch (IllegalStateException exception) {
            log.error("Failed to read {}: {}", dataFile, exception.getMessage());
            return 0;
        }
        return appendEntries(target.get(), new ArrayList<>(rows), dataFile.toString(), removeDuplicates);
    }

    /**
     * Reads a persisted ODS file or URL into an instance.
     *
     * @return false if the input could not be read (the instance is left unchanged)
     */
    public boolean readOds(String source, String instanceName) {
        Optional<OdsInstance> target = resolve(instanceName);
        if (target.isEmpty()) {
            return false;
        }
        Optional<List<Map<String, Object>>> entries = resolveEntries(RecordInput.file(source));
        if (entries.isEmpty()) {
            log.warn("Failed to read {} -- keeping instance {} unchanged.", source, target.get().getName());
            return false;
        }
        appendEntries(target.get(), entries.get(), source, false);
        return true;
    }

    /**
     * Appends copies of all records of {@code fromName} to {@code toName}. Where duplicates collapse,
     * the record arriving from {@code fromName} survives.
     */
    public boolean merge(String fromName, String toName, boolean removeDuplicates) {
        Optional<OdsInstance> source = resolve(fromName);
        Optional<OdsInstance> target = resolve(toName);
        if (source.isEmpty() || target.isEmpty()) {
            return false;
        }
        log.info("Updating {} from {}", target.get().getName(), source.get().getName());
        List<OdsRecord> incoming = source.get().copyRecords();
        OdsInstance instance = target.get();
        for (OdsRecord record : incoming) {
            instance.append(record);
        }
        log.info("Read {} records from instance {}.", incoming.size(), source.get().getName());
        if (removeDuplicates) {
            removeDuplicates(instance);
        }
        instance.recomputeMetadata();
        report(instance);
        return true;
    }

    private Optional<List<Map<String, Object>>> resolveEntries(RecordInput input) {
        if (input == null) {
            log.warn("No input given");
            return Optional.empty();
        }
        try {
            return Optional.of(input.resolve(odsFileService));
        } catch (IllegalStateException | IllegalArgumentException exception) {
            log.error("Failed to read {}: {}", input.describe(), exception.getMessage());
            return Optional.empty();
        }
    }

    private int appendEntries(OdsInstance instance, List<Map<String, Object>> entries, String description, boolean removeDuplicates) {
        int added = 0;
        for (int i = 0; i < entries.size(); i++) {
            Map<String, Object> entry = entries.get(i);
            if (entry == null) {
                log.warn("Entry {} of {} is not a record -- skipping", i, description);
                continue;
            }
            instance.append(instance.getNormalizer().normalize(entry, defaults));
            added++;
        }
        log.info("Read {} records from {}.", added, description);
        if (removeDuplicates) {
            removeDuplicates(instance);
        }
        instance.recomputeMetadata();
        report(instance);
        return added;
    }

    // ------------------------------------------------------------------ modify

    public int updateEntry(String instanceName, int index, RecordUpdate update) {
        Optional<OdsInstance> target = resolve(instanceName);
        if (target.isEmpty() || update == null) {
            return 0;
        }
        return target.get().updateAt(index, update);
    }

    /**
     * Reorders an instance on {@code fields} (the standard's time sort order when empty).
     *
     * @return number of records after the operation
     */
    public int sortAndDedup(String instanceName, List<String> fields, boolean collapse, boolean reverse) {
        Optional<OdsInstance> target = resolve(instanceName);
        if (target.isEmpty()) {
            return 0;
        }
        List<String> keys = CollectionUtils.isEmpty(fields) ? standard.sortOrderTime() : fields;
        OdsInstance instance = target.get();
        instance.sortAndDedup(keys, collapse, reverse);
        instance.recomputeMetadata();
        return instance.getNumberOfRecords();
    }

    public int cullByDuplicate(String instanceName) {
        Optional<OdsInstance> target = resolve(instanceName);
        if (target.isEmpty()) {
            return 0;
        }
        removeDuplicates(target.get());
        target.get().recomputeMetadata();
        return target.get().getNumberOfRecords();
    }

    private void removeDuplicates(OdsInstance instance) {
        log.info("Culling ODS for duplicates");
        int starting = instance.getNumberOfRecords();
        instance.sortAndDedup(standard.sortOrderTime(), true, false);
        if (instance.getNumberOfRecords() == starting) {
            log.info("retaining all.");
        } else {
            log.info("retaining {} of {}", instance.getNumberOfRecords(), starting);
        }
    }

    public int cullByTime(CullMode mode, String instanceName) {
        return cullByTime("now", mode, instanceName);
    }

    /**
     * Removes records that are stale (stopped before {@code cullTime}) or, for
     * {@link CullMode#INACTIVE}, also not yet started. Records without a usable start or stop are kept.
     *
     * @param cullTime an {@link Instant} or anything the date interpreter accepts
     * @return number of records retained, or -1 if nothing was culled because of a bad argument
     */
    public int cullByTime(Object cullTime, CullMode mode, String instanceName) {
        if (mode == null) {
            log.warn("Invalid cull parameter: {}", mode);
            return -1;
        }
        Optional<OdsInstance> target = resolve(instanceName);
        if (target.isEmpty()) {
            return -1;
        }
        Optional<Instant> when = dateInterpreter.interpret(cullTime);
        if (when.isEmpty()) {
            log.warn("Invalid cull time: {}", cullTime);
            return -1;
        }
        OdsInstance instance = target.get();
        Instant reference = when.get();
        log.info("Culling ODS for {} by {}", reference, mode.name().toLowerCase());
        List<OdsRecord> retained = new ArrayList<>();
        for (OdsRecord record : instance.getRecords()) {
            if (keepAt(record, reference, mode)) {
                retained.add(record.copy());
            }
        }
        int starting = instance.getNumberOfRecords();
        instance.replaceRecords(retained);
        log.info("retaining {} of {}", retained.size(), starting);
        return retained.size();
    }

    private boolean keepAt(OdsRecord record, Instant reference, CullMode mode) {
        Optional<Instant> stop = record.instant(standard.stop());
        if (stop.isPresent() && reference.isAfter(stop.get())) {
            return false;
        }
        if (mode == CullMode.INACTIVE) {
            Optional<Instant> start = record.instant(standard.start());
            return start.isEmpty() || !reference.isBefore(start.get());
        }
        return true;
    }

    /**
     * Keeps only the records that passed validation.
     *
     * @return number of records retained
     */
    public int cullByInvalid(String instanceName) {
        Optional<OdsInstance> target = resolve(instanceName);
        if (target.isEmpty()) {
            return 0;
        }
        OdsInstance instance = target.get();
        instance.recomputeMetadata();
        log.info("Culling ODS for invalid records.");
        int starting = instance.getNumberOfRecords();
        if (instance.getValidIndices().size() == starting) {
            log.info("retaining all.");
            return starting;
        }
        List<OdsRecord> culled = new ArrayList<>();
        for (Integer index : instance.getValidIndices()) {
            culled.add(instance.getRecord(index).copy());
        }
        instance.replaceRecords(culled);
        if (culled.isEmpty()) {
            log.warn("Retaining no records.");
        } else {
            log.info("retaining {} of {}", culled.size(), starting);
        }
        return culled.size();
    }

    /**
     * Drops records whose source never rises above {@code elevationLimitDeg} and narrows the rest to
     * their visible window.
     *
     * @return number of records retained
     */
    public int updateByElevation(double elevationLimitDeg, Duration timeStep, String instanceName) {
        Optional<OdsInstance> target = resolve(instanceName);
        if (target.isEmpty()) {
            return 0;
        }
        OdsInstance instance = target.get();
        log.info("Updating {} for el limit {}", instance.getName(), elevationLimitDeg);
        List<OdsRecord> updated = new ArrayList<>();
        for (OdsRecord record : instance.getRecords()) {
            Optional<TimeWindow> window = odsCheck.observation(record, standard, elevationLimitDeg, timeStep);
            if (window.isPresent()) {
                OdsRecord visible = record.copy();
                visible.set(standard.start(), window.get().start());
                visible.set(standard.stop(), window.get().stop());
                updated.add(visible);
            }
        }
        int starting = instance.getNumberOfRecords();
        instance.replaceRecords(updated);
        log.info("retaining {} of {}", updated.size(), starting);
        return updated.size();
    }

    public boolean updateByContinuity(double offsetSeconds, AdjustSide adjust, String instanceName) {
        if (adjust == null) {
            log.warn("Invalid adjust spec - {}", adjust);
            return false;
        }
        Optional<OdsInstance> target = resolve(instanceName);
        if (target.isEmpty()) {
            return false;
        }
        target.get().replaceRecords(odsCheck.continuity(target.get(), offsetSeconds, adjust));
        return true;
    }

    /**
     * Resets start/stop of every record from {@code times}; a {@code null} element leaves that record
     * as it is.
     */
    public boolean updateTimes(List<TimeWindow> times, String instanceName) {
        Optional<OdsInstance> target = resolve(instanceName);
        if (target.isEmpty()) {
            return false;
        }
        OdsInstance instance = target.get();
        if (times == null || times.size() != instance.getNumberOfRecords()) {
            log.warn("times list doesn't have the right number of entries");
            return false;
        }
        List<OdsRecord> updated = instance.copyRecords();
        for (int i = 0; i < times.size(); i++) {
            TimeWindow window = times.get(i);
            if (window != null) {
                updated.get(i).set(standard.start(), window.start());
                updated.get(i).set(standard.stop(), window.stop());
            }
        }
        instance.replaceRecords(updated);
        return true;
    }

    public boolean updateTimes(Object start, Duration observationLength, String instanceName) {
        Optional<OdsInstance> target = resolve(instanceName);
        if (target.isEmpty() || observationLength == null) {
            log.warn("haven't specified enough parameters.");
            return false;
        }
        return updateTimes(start, Collections.nCopies(target.get().getNumberOfRecords(), observationLength), instanceName);
    }

    /**
     * Lays the records out back to back from {@code start}, one second apart, each lasting its entry of
     * {@code observationLengths}.
     */
    public boolean updateTimes(Object start, List<Duration> observationLengths, String instanceName) {
        Optional<OdsInstance> target = resolve(instanceName);
        if (target.isEmpty()) {
            return false;
        }
        Optional<Instant> first = dateInterpreter.interpret(start);
        if (first.isEmpty() || observationLengths == null) {
            log.warn("haven't specified enough parameters.");
            return false;
        }
        if (observationLengths.size() != target.get().getNumberOfRecords()) {
            log.warn("observation length list doesn't have the right number of entries");
            return false;
        }
        List<TimeWindow> times = new ArrayList<>(observationLengths.size());
        Instant current = first.get();
        for (Duration length : observationLengths) {
            times.add(new TimeWindow(current, current.plus(length)));
            current = current.plus(length).plusSeconds(1);
        }
        return updateTimes(times, instanceName);
    }

    // ------------------------------------------------------------------ analysis

    public Optional<CoverageReport> coverage(String instanceName) {
        return resolve(instanceName).flatMap(odsCheck::coverage);
    }

    /** Overlap-adjusted copies of the records; the instance itself is not changed. */
    public List<OdsRecord> continuity(String instanceName, double offsetSeconds, AdjustSide adjust) {
        Optional<OdsInstance> target = resolve(instanceName);
        if (target.isEmpty() || adjust == null) {
            return List.of();
        }
        return odsCheck.continuity(target.get(), offsetSeconds, adjust);
    }

    /**
     * Indices of the records whose [start, stop] contains {@code when}. A non-null {@code source} is
     * read into a temporary instance, dropped afterwards, so the indices follow the order of the
     * source; otherwise the working instance is checked.
     */
    public List<Integer> checkActive(Object when, String source) {
        Optional<Instant> time = dateInterpreter.interpret(when);
        if (time.isEmpty()) {
            log.warn("Invalid check time: {}", when);
            return List.of();
        }
        if (source == null) {
            log.info("Not reading new ODS instance for check_active.");
            return resolve(null).map(working -> activeIndices(working, time.get())).orElse(List.of());
        }
        if (!createTemporary(CHECK_ACTIVE)) {
            return List.of();
        }
        try {
            if (!readOds(source, CHECK_ACTIVE)) {
                return List.of();
            }
            return activeIndices(instances.get(CHECK_ACTIVE), time.get());
        } finally {
            instances.remove(CHECK_ACTIVE);
        }
    }

    private List<Integer> activeIndices(OdsInstance instance, Instant time) {
        List<Integer> active = new ArrayList<>();
        List<OdsRecord> records = instance.getRecords();
        for (int i = 0; i < records.size(); i++) {
            Optional<Instant> start = records.get(i).instant(standard.start());
            Optional<Instant> stop = records.get(i).instant(standard.stop());
            if (start.isPresent() && stop.isPresent() && new TimeWindow(start.get(), stop.get()).contains(time)) {
                active.add(i);
            }
        }
        return active;
    }

    public void instanceReport(String instanceName) {
        resolve(instanceName).ifPresent(this::report);
    }

    private void report(OdsInstance instance) {
        int total = instance.getNumberOfRecords();
        Map<Integer, List<String>> invalid = instance.getInvalidReasons();
        if (total > 0 && invalid.size() == total) {
            log.warn("All records ({}) were invalid.", total);
        } else if (!invalid.isEmpty()) {
            log.warn("{} / {} were not valid.", invalid.size(), total);
            invalid.forEach((index, reasons) -> log.warn("Entry {}:  {}", index, String.join(", ", reasons)));
        } else {
            log.info("{} are all valid.", total);
        }
        if (!instance.getUnknownFieldNames().isEmpty()) {
            log.warn("Instance {} received unrecognized fields: {}", instance.getName(), instance.getUnknownFieldNames());
        }
    }

    // ------------------------------------------------------------------ output

    public boolean writeInstance(Path fileName, String instanceName) {
        Optional<OdsInstance> target = resolve(instanceName);
        if (target.isEmpty()) {
            return false;
        }
        try {
            odsFileService.write(fileName, target.get().getRecords());
            return true;
        } catch (IllegalStateException exception) {
            log.error("Failed to write {}: {}", fileName, exception.getMessage());
            return false;
        }
    }

    public boolean writeFile(Path fileName, String instanceName, List<String> columns) {
        return writeFile(fileName, instanceName, columns, exportSeparator);
    }

    /**
     * Exports an instance as delimited text.
     *
     * @throws IllegalArgumentException if a requested column is not a field of the standard
     */
    public boolean writeFile(Path fileName, String instanceName, List<String> columns, String separator) {
        Optional<OdsInstance> target = resolve(instanceName);
        if (target.isEmpty()) {
            return false;
        }
        if (target.get().isEmpty()) {
            log.warn("Writing an empty ODS file!");
        }
        List<String> exported = CollectionUtils.isEmpty(columns) ? standard.fields() : columns;
        try {
            tabularFileService.write(fileName, target.get().getRecords(), exported, standard.fields(), separator);
            return true;
        } catch (IllegalStateException exception) {
            log.error("Failed to write {}: {}", fileName, exception.getMessage());
            return false;
        }
    }

    public boolean writeOds(Path fileName, RecordInput adds) {
        return writeOds(fileName, adds, null, DEFAULT_CULL);
    }

    /**
     * Standard pipeline: reads {@code original} (instance name, file or URL; empty when null), merges
     * {@code adds} into it with duplicate removal, culls, and writes the result. Null {@code adds}
     * means the working instance.
     */
    public boolean writeOds(Path fileName, RecordInput adds, String original, Set<CullOption> cull) {
        List<String> temporary = new ArrayList<>();
        try {
            String toAdd = workingInstance;
            if (adds != null) {
                Optional<List<Map<String, Object>>> entries = resolveEntries(adds);
                if (entries.isEmpty()) {
                    return false;
                }
                if (!createTemporary(INSTANCE_TO_ADD)) {
                    return false;
                }
                temporary.add(INSTANCE_TO_ADD);
                appendEntries(instances.get(INSTANCE_TO_ADD), entries.get(), adds.describe(), false);
                toAdd = INSTANCE_TO_ADD;
            }
            return mergeCullAndWrite(fileName, toAdd, original, cull, temporary);
        } finally {
            temporary.forEach(instances::remove);
        }
    }

    public boolean writeOdsFromInstance(Path fileName, String addsInstance, String original, Set<CullOption> cull) {
        if (resolve(addsInstance).isEmpty()) {
            return false;
        }
        List<String> temporary = new ArrayList<>();
        try {
            return mergeCullAndWrite(fileName, addsInstance == null ? workingInstance : addsInstance, original, cull, temporary);
        } finally {
            temporary.forEach(instances::remove);
        }
    }

    private boolean mergeCullAndWrite(Path fileName, String toAdd, String original, Set<CullOption> cull, List<String> temporary) {
        String toUpdate;
        if (original != null && instances.containsKey(original)) {
            toUpdate = original;
        } else {
            if (!createTemporary(INSTANCE_TO_UPDATE)) {
                return false;
            }
            temporary.add(INSTANCE_TO_UPDATE);
            toUpdate = INSTANCE_TO_UPDATE;
            if (original != null) {
                readOds(original, INSTANCE_TO_UPDATE);
            }
        }

        merge(toAdd, toUpdate, true);

        OdsInstance target = instances.get(toUpdate);
        int preCull = target.getNumberOfRecords();
        Set<CullOption> options = cull == null ? EnumSet.noneOf(CullOption.class) : cull;
        if (options.contains(CullOption.TIME)) {
            cullByTime("now", CullMode.STALE, toUpdate);
        }
        if (options.contains(CullOption.DUPLICATE)) {
            cullByDuplicate(toUpdate);
        }
        if (target.isEmpty()) {
            log.warn("Writing an empty ODS file!  Pre-cull count was {}", preCull);
        }
        return writeInstance(fileName, toUpdate);
    }

    public boolean onlineOdsMonitor(Path logFile, List<String> columns) {
        if (!StringUtils.hasText(onlineUrl)) {
            log.warn("No online ODS URL configured (ods.online-url)");
            return false;
        }
        return onlineOdsMonitor(onlineUrl, logFile, columns, exportSeparator);
    }

    /**
     * Appends the records active now at {@code url} to a local delimited log, without duplicates.
     * An unreadable log is left untouched.
     */
    public boolean onlineOdsMonitor(String url, Path logFile, List<String> columns, String separator) {
        List<String> temporary = new ArrayList<>();
        try {
            if (!createTemporary(FROM_WEB)) {
                return false;
            }
            temporary.add(FROM_WEB);
            if (!readOds(url, FROM_WEB)) {
                return false;
            }
            cullByTime("now", CullMode.INACTIVE, FROM_WEB);

            if (!createTemporary(FROM_LOG)) {
                return false;
            }
            temporary.add(FROM_LOG);
            if (Files.exists(logFile)) {
                List<Map<String, Object>> rows;
                try {
                    rows = tabularFileService.read(logFile, TabularReadOptions.separatedBy(separator));
                } catch (IllegalStateException exception) {
                    log.error("Failed to read log {}: {} -- not rewriting it", logFile, exception.getMessage());
                    return false;
                }
                appendEntries(instances.get(FROM_LOG), new ArrayList<>(rows), logFile.toString(), true);
            }
            merge(FROM_WEB, FROM_LOG, true);
            return writeFile(logFile, FROM_LOG, columns, separator);
        } finally {
            temporary.forEach(instances::remove);
        }
    }

    private boolean createTemporary(String name) {
        if (instances.containsKey(name)) {
            log.error("{} is used for a temporary instance -- rename or remove the existing instance first.", name);
            return false;
        }
        return createInstance(name, false, false);
    }
}
