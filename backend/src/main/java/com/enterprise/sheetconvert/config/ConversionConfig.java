package com.enterprise.sheetconvert.config;

import com.enterprise.sheetconvert.extraction.ExtractionEngine;
import com.enterprise.sheetconvert.extraction.layout.TableLayoutAnalyzer;
import com.enterprise.sheetconvert.extraction.ocr.RecognitionTableExtractor;
import com.enterprise.sheetconvert.extraction.ocr.TextRecognizer;
import com.enterprise.sheetconvert.extraction.pdf.PageRasterizer;
import com.enterprise.sheetconvert.extraction.pdf.StructuredTableExtractor;
import com.enterprise.sheetconvert.extraction.workbook.WorkbookAssembler;
import com.enterprise.sheetconvert.service.QuotaResetPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class ConversionConfig {

    @Value("${aws.s3.upload-prefix:uploads}")
    private String uploadPrefix;

    @Value("${aws.s3.result-prefix:results}")
    private String resultPrefix;

    @Value("${conversion.upload-url-ttl:PT15M}")
    private Duration uploadUrlTtl;

    @Value("${conversion.download-url-ttl:PT1H}")
    private Duration downloadUrlTtl;

    @Value("${conversion.max-attempts:3}")
    private int maxAttempts;

    @Value("${conversion.retry-backoff:PT10S}")
    private Duration retryBackoff;

    @Value("${conversion.processing-timeout:PT5M}")
    private Duration processingTimeout;

    @Value("${conversion.max-source-bytes:20971520}")
    private long maxSourceBytes;

    @Value("${conversion.quota.free-allotment:5}")
    private int freeAllotment;

    @Value("${conversion.quota.reset-policy:NEVER}")
    private QuotaResetPolicy quotaResetPolicy;

    @Value("${conversion.worker.threads:4}")
    private int workerThreads;

    @Value("${conversion.extraction.min-fill-ratio:0.30}")
    private double minFillRatio;

    @Value("${conversion.extraction.render-dpi:200}")
    private int renderDpi;

    @Bean
    public ConversionSettings conversionSettings() {
        return ConversionSettings.builder()
                .uploadPrefix(uploadPrefix)
                .resultPrefix(resultPrefix)
                .uploadUrlTtl(uploadUrlTtl)
                .downloadUrlTtl(downloadUrlTtl)
                .maxAttempts(maxAttempts)
                .retryBackoff(retryBackoff)
                .processingTimeout(processingTimeout)
                .maxSourceBytes(maxSourceBytes)
                .freeAllotment(freeAllotment)
                .quotaResetPolicy(quotaResetPolicy)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ExtractionEngine extractionEngine(ObjectProvider<TextRecognizer> textRecognizer) {
        TableLayoutAnalyzer analyzer = new TableLayoutAnalyzer();
        TextRecognizer recognizer = textRecognizer.getIfAvailable();
        RecognitionTableExtractor recognition = null;
        if (recognizer != null) {
            recognition = new RecognitionTableExtractor(new PageRasterizer(renderDpi), recognizer, analyzer);
        } else {
            log.warn("No text recognizer configured; scanned documents will not be converted");
        }
        return new ExtractionEngine(new StructuredTableExtractor(analyzer), recognition, minFillRatio);
    }

    @Bean
    public WorkbookAssembler workbookAssembler() {
        return new WorkbookAssembler();
    }

    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService conversionWorkerPool() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "conversion-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newScheduledThreadPool(workerThreads, threadFactory);
    }
}
