package com.axcockpit.backend.boot;

import com.axcockpit.backend.config.CockpitProps;
import com.axcockpit.backend.ingest.IngestReport;
import com.axcockpit.backend.ingest.SnapshotFileName;
import com.axcockpit.backend.ingest.SnapshotIngestService;
import com.axcockpit.backend.repo.SnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * 기동 시 inbox 디렉터리의 YYYY-MM-DD.xlsx 중 아직 적재되지 않은 파일을 날짜순으로 적재한다.
 */
@Component
@Order(100)
public class StartupSnapshotLoader implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupSnapshotLoader.class);

    private final CockpitProps props;
    private final SnapshotIngestService ingestService;
    private final SnapshotRepository snapshotRepository;

    public StartupSnapshotLoader(CockpitProps props,
                                 SnapshotIngestService ingestService,
                                 SnapshotRepository snapshotRepository) {
        this.props = props;
        this.ingestService = ingestService;
        this.snapshotRepository = snapshotRepository;
    }

    @Override
    public void run(ApplicationArguments args) {
        CockpitProps.Ingest cfg = props.getIngest();
        if (!cfg.isOnStartup()) {
            log.info("[ingest] 앱 기동 - 자동 적재 비활성화(on-startup=false). 스킵합니다.");
            return;
        }
        if (cfg.getInboxDir() == null || cfg.getInboxDir().isBlank()) {
            log.warn("[ingest] 앱 기동 - inbox-dir 미설정. 스킵합니다.");
            return;
        }
        Path inbox = Paths.get(cfg.getInboxDir());
        if (!Files.isDirectory(inbox)) {
            log.warn("[ingest] 앱 기동 - inbox 디렉터리 없음: {}", inbox.toAbsolutePath());
            return;
        }

        try {
            int loaded = loadPending(inbox, props.getAudit().getDefaultActor());
            log.info("[ingest] 앱 기동 - 자동 적재 완료 loaded={}", loaded);
        } catch (Exception e) {
            // 여기서 절대 예외를 바깥으로 던지지 않는다
            log.warn("[ingest] 앱 기동 - 자동 적재 실패(무시하고 기동 계속): {}", e.toString());
            log.debug("[ingest] 상세 스택트레이스", e);
        }
    }

    int loadPending(Path inbox, String actor) throws IOException {
        List<Path> files;
        try (Stream<Path> s = Files.list(inbox)) {
            files = s.filter(Files::isRegularFile)
                    .filter(p -> SnapshotFileName.matches(p.getFileName().toString()))
                    // 파일명이 날짜이므로 이름순 == 날짜순
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        }

        int loaded = 0;
        for (Path file : files) {
            String name = file.getFileName().toString();
            if (snapshotRepository.existsBySnapshotDate(SnapshotFileName.parse(name))) {
                log.debug("[ingest] {} already ingested", name);
                continue;
            }
            try (InputStream in = Files.newInputStream(file)) {
                IngestReport report = ingestService.ingest(in, name, actor);
                if (report.isSuccess()) {
                    loaded++;
                } else {
                    log.warn("[ingest] {} rejected: {} {}", name, report.getError().getKind(), report.getError().getDetail());
                }
            } catch (Exception e) {
                // 한 파일 실패가 나머지 파일 적재를 막지 않는다
                log.warn("[ingest] {} 적재 실패(다음 파일 계속): {}", name, e.toString());
                log.debug("[ingest] 상세 스택트레이스", e);
            }
        }
        return loaded;
    }
}
