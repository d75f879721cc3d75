package com.enterprise.sheetconvert.extraction.ocr;

import com.enterprise.sheetconvert.extraction.TransientExtractionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.AnalyzeDocumentRequest;
import software.amazon.awssdk.services.textract.model.AnalyzeDocumentResponse;
import software.amazon.awssdk.services.textract.model.Block;
import software.amazon.awssdk.services.textract.model.BlockType;
import software.amazon.awssdk.services.textract.model.BoundingBox;
import software.amazon.awssdk.services.textract.model.Document;
import software.amazon.awssdk.services.textract.model.FeatureType;
import software.amazon.awssdk.services.textract.model.InternalServerErrorException;
import software.amazon.awssdk.services.textract.model.LimitExceededException;
import software.amazon.awssdk.services.textract.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.textract.model.RelationshipType;
import software.amazon.awssdk.services.textract.model.TextractException;
import software.amazon.awssdk.services.textract.model.ThrottlingException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link TextRecognizer} backed by Textract {@code AnalyzeDocument} with the TABLES feature.
 *
 * TABLE/CELL blocks become grids directly; a spanned cell's text goes to its top-left
 * position. WORD blocks are returned as well so callers can run their own layout
 * analysis when Textract finds text but no table.
 */
public class TextractTextRecognizer implements TextRecognizer {

    private static final Logger log = LoggerFactory.getLogger(TextractTextRecognizer.class);

    private final TextractClient textractClient;

    public TextractTextRecognizer(TextractClient textractClient) {
        this.textractClient = textractClient;
    }

    @Override
    public RecognizedPage recognize(int pageNumber, byte[] png) {
        log.info("Calling AnalyzeDocument for page {} ({} bytes)", pageNumber, png.length);

        AnalyzeDocumentResponse response;
        try {
            response = textractClient.analyzeDocument(AnalyzeDocumentRequest.builder()
                    .document(Document.builder()
                            .bytes(SdkBytes.fromByteArray(png))
                            .build())
                    .featureTypes(FeatureType.TABLES)
                    .build());
        } catch (ThrottlingException | ProvisionedThroughputExceededException
                | LimitExceededException | InternalServerErrorException e) {
            throw new TransientExtractionException("Textract unavailable for page " + pageNumber + ": " + e.getMessage(), e);
        } catch (TextractException e) {
            if (e.statusCode() >= 500) {
                throw new TransientExtractionException("Textract failed for page " + pageNumber + ": " + e.getMessage(), e);
            }
            log.warn("Textract rejected page {}: {}", pageNumber, e.getMessage());
            return RecognizedPage.empty(pageNumber, "Page " + pageNumber + " could not be recognised: "
                    + e.getMessage());
        } catch (SdkClientException e) {
            // timeouts and connection failures
            throw new TransientExtractionException("Textract call failed for page " + pageNumber + ": " + e.getMessage(), e);
        }

        List<Block> blocks = response.blocks();
        log.info("Textract returned {} blocks for page {}", blocks.size(), pageNumber);
        return toPage(pageNumber, blocks);
    }

    static RecognizedPage toPage(int pageNumber, List<Block> blocks) {
        Map<String, Block> blockMap = new HashMap<>();
        for (Block block : blocks) {
            blockMap.put(block.id(), block);
        }

        List<RecognizedPage.Table> tables = new ArrayList<>();
        List<RecognizedPage.Word> words = new ArrayList<>();
        for (Block block : blocks) {
            if (block.blockType() == BlockType.TABLE) {
                RecognizedPage.Table table = toTable(block, blockMap);
                if (table != null) {
                    tables.add(table);
                }
            } else if (block.blockType() == BlockType.WORD && block.text() != null && block.geometry() != null) {
                BoundingBox box = block.geometry().boundingBox();
                words.add(new RecognizedPage.Word(
                        value(box.left()), value(box.top()), value(box.width()), value(box.height()), block.text()));
            }
        }
        return new RecognizedPage(pageNumber, tables, words, List.of());
    }

    private static RecognizedPage.Table toTable(Block table, Map<String, Block> blockMap) {
        if (table.relationships() == null) {
            return null;
        }
        Map<Integer, Map<Integer, String>> grid = new HashMap<>();
        int rowCount = 0;
        int columnCount = 0;

        for (var rel : table.relationships()) {
            if (rel.type() != RelationshipType.CHILD) {
                continue;
            }
            for (String cellId : rel.ids()) {
                Block cell = blockMap.get(cellId);
                if (cell == null || cell.blockType() != BlockType.CELL || cell.rowIndex() == null
                        || cell.columnIndex() == null) {
                    continue;
                }
                int r = cell.rowIndex() - 1;
                int c = cell.columnIndex() - 1;
                int rowSpan = cell.rowSpan() != null ? Math.max(cell.rowSpan(), 1) : 1;
                int columnSpan = cell.columnSpan() != null ? Math.max(cell.columnSpan(), 1) : 1;
                rowCount = Math.max(rowCount, r + rowSpan);
                columnCount = Math.max(columnCount, c + columnSpan);
                grid.computeIfAbsent(r, k -> new HashMap<>()).put(c, extractText(cell, blockMap));
            }
        }
        if (rowCount == 0 || columnCount == 0) {
            return null;
        }

        List<List<String>> rows = new ArrayList<>(rowCount);
        for (int r = 0; r < rowCount; r++) {
            Map<Integer, String> row = grid.getOrDefault(r, Map.of());
            List<String> values = new ArrayList<>(columnCount);
            for (int c = 0; c < columnCount; c++) {
                values.add(row.getOrDefault(c, ""));
            }
            rows.add(values);
        }
        float top = table.geometry() != null ? value(table.geometry().boundingBox().top()) : 0f;
        return new RecognizedPage.Table(top, rows);
    }

    private static String extractText(Block block, Map<String, Block> blockMap) {
        if (block.relationships() == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (var rel : block.relationships()) {
            if (rel.type() == RelationshipType.CHILD) {
                for (String childId : rel.ids()) {
                    Block child = blockMap.get(childId);
                    if (child != null && child.blockType() == BlockType.WORD && child.text() != null) {
                        if (!sb.isEmpty()) {
                            sb.append(' ');
                        }
                        sb.append(child.text());
                    }
                }
            }
        }
        return sb.toString().trim();
    }

    private static float value(Float f) {
        return f != null ? f : 0f;
    }
}
