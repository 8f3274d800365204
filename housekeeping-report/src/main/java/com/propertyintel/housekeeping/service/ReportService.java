package com.propertyintel.housekeeping.service;

import com.propertyintel.housekeeping.config.HousekeepingReportProperties;
import com.propertyintel.housekeeping.model.FeatureFact;
import com.propertyintel.housekeeping.model.HousekeepingAnalysis;
import com.propertyintel.housekeeping.model.HousekeepingFact;
import com.propertyintel.housekeeping.model.HousekeepingRow;
import com.propertyintel.housekeeping.model.RawTable;
import com.propertyintel.housekeeping.model.ReportPayload;
import com.propertyintel.housekeeping.model.RoomUsageAnalysis;
import com.propertyintel.housekeeping.model.RoomUsageFact;
import com.propertyintel.housekeeping.model.RoomUsageRow;
import com.propertyintel.housekeeping.model.RotationRecord;
import com.propertyintel.housekeeping.output.ReportWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Runs one report end to end:
 *   read → normalize → derive facts → aggregate → score → assemble → write.
 *
 * Both inputs are located and schema-checked before the output directory is
 * created, so a failed run leaves nothing behind.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReportService {

    private final CsvTableReader reader;
    private final RowNormalizer normalizer;
    private final FactDeriver factDeriver;
    private final ChangeLogAggregator changeLogAggregator;
    private final RoomUsageAggregator roomUsageAggregator;
    private final RotationScorer rotationScorer;
    private final ReportAssembler assembler;
    private final ReportWriter writer;
    private final HousekeepingReportProperties properties;
    private final Clock clock;

    public record ReportResult(Path outputDir, List<Path> files, ReportPayload payload) {}

    public ReportResult run(Path housekeepingCsv, Path roomUsageCsv) {
        log.info("Starting report: housekeeping={}, roomUsage={}", housekeepingCsv, roomUsageCsv);
        LocalDateTime now = LocalDateTime.now(clock);

        ReportPayload payload = analyze(housekeepingCsv, roomUsageCsv, now);

        Path outputDir = writer.createRunDirectory(Path.of(properties.getOutput().getBaseDir()), now);
        List<Path> files = writer.write(payload, outputDir);

        log.info("Report complete: {} files in {}", files.size(), outputDir);
        return new ReportResult(outputDir, files, payload);
    }

    /** Everything up to the payload. Performs no writes. */
    public ReportPayload analyze(Path housekeepingCsv, Path roomUsageCsv, LocalDateTime generatedAt) {
        reader.requireExists(housekeepingCsv);
        reader.requireExists(roomUsageCsv);

        RawTable hskTable = reader.read(housekeepingCsv);
        RawTable usageTable = reader.read(roomUsageCsv);
        normalizer.validate(hskTable, RowNormalizer.HOUSEKEEPING_COLUMNS);
        normalizer.validate(usageTable, RowNormalizer.ROOM_USAGE_COLUMNS);

        HousekeepingAnalysis hsk = analyzeHousekeeping(normalizer.normalizeHousekeeping(hskTable));
        RoomUsageAnalysis usage = analyzeRoomUsage(normalizer.normalizeRoomUsage(usageTable));

        return assembler.assemble(hsk, usage, generatedAt);
    }

    public HousekeepingAnalysis analyzeHousekeeping(List<HousekeepingRow> rows) {
        List<HousekeepingFact> facts = factDeriver.deriveHousekeeping(rows);
        List<RotationRecord> rotation = rotationScorer.score(facts);
        double parseRate = factDeriver.dateParseSuccessRate(facts);

        log.info("Housekeeping: {} rows, date parse success {}", facts.size(), Numbers.format(Numbers.round(parseRate, 4)));

        return HousekeepingAnalysis.builder()
                .facts(facts)
                .dateParseSuccessRate(parseRate)
                .byDay(changeLogAggregator.byDay(facts))
                .byRoomType(changeLogAggregator.byRoomType(facts))
                .byClosingHousekeeper(changeLogAggregator.byClosingHousekeeper(facts))
                .byUsername(changeLogAggregator.byUsername(facts))
                .transitionMatrix(changeLogAggregator.transitionMatrix(facts))
                .changedTransitions(changeLogAggregator.changedTransitions(facts))
                .rotation(rotation)
                .rotationCallouts(rotationScorer.callouts(rotation))
                .build();
    }

    public RoomUsageAnalysis analyzeRoomUsage(List<RoomUsageRow> rows) {
        int topN = properties.effectiveTopN();
        List<RoomUsageFact> facts = factDeriver.deriveRoomUsage(rows);
        List<FeatureFact> features = factDeriver.expandFeatures(facts);

        log.info("Room usage: {} rows, {} feature mentions", facts.size(), features.size());

        return RoomUsageAnalysis.builder()
                .facts(facts)
                .featureFacts(features)
                .byRoomType(roomUsageAggregator.byRoomType(facts))
                .byFeature(roomUsageAggregator.byFeature(features))
                .topRooms(roomUsageAggregator.topRooms(facts, topN))
                .topFeatures(roomUsageAggregator.topFeatures(features, topN))
                .build();
    }
}
