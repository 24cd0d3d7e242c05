package io.github.yok.band.out;

import io.github.yok.band.core.path.TickMark;
import io.github.yok.band.core.plot.BandPlotData;
import io.github.yok.band.core.plot.SegmentPlotData;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * プロット用データを CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（view は表示の種類）。
 * </p>
 *
 * <ul>
 * <li>{@code band_<view>_bands.csv}（区間・バンド・点ごとの距離と固有値、スペクトル重み、スピン軸射影）</li>
 * <li>{@code band_<view>_projections.csv}（射影チャネルごとの重み。チャネルがある場合のみ）</li>
 * <li>{@code band_<view>_ticks.csv}（高対称点の目盛り）</li>
 * </ul>
 *
 * <p>
 * 区間番号は自然な区間分割での 1 始まりの番号で、逆向きの区間は負の値で書きます。
 * </p>
 */
@Slf4j
public final class CsvPlotDataWriter implements PlotDataWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "band";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 出力先が空の場合に発生します
     */
    public CsvPlotDataWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * プロット用データを出力します。
     *
     * @param data プロット用データです
     * @param viewName 表示の種類を表す名前です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(BandPlotData data, String viewName) {
        if (data == null) {
            throw new IllegalArgumentException("data は null 不可です");
        }
        if (viewName == null || viewName.isEmpty()) {
            throw new IllegalArgumentException("viewName は必須です");
        }

        try {
            Files.createDirectories(outputDir);

            // 1) 固有値
            writeBandsCsv(data, viewName);

            // 2) 射影チャネル
            if (!data.getChannelLabels().isEmpty()) {
                writeProjectionsCsv(data, viewName);
            }

            // 3) 目盛り
            writeTicksCsv(data, viewName);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
        log.info("プロット用データを出力しました。出力先={}、表示={}", outputDir, viewName);
    }

    private void writeBandsCsv(BandPlotData data, String viewName) throws IOException {
        Path file = outputDir.resolve(buildFileName(viewName, "bands"));
        int[] bands = data.getBandIndices();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("segment", "band", "point", "distance", "energy",
                                "spectralWeight", "spinProjection")
                        .build().print(w)) {

            for (SegmentPlotData segment : data.getSegments()) {
                int segmentNo = signedSegment(segment);
                double[] d = segment.getDistances();
                for (int b = 0; b < bands.length; b++) {
                    for (int p = 0; p < d.length; p++) {
                        pr.printRecord(segmentNo, bands[b], p, d[p], segment.getEnergies()[b][p],
                                valueOrEmpty(segment.getSpectralWeights(), b, p),
                                valueOrEmpty(segment.getSpinProjections(), b, p));
                    }
                }
            }
        }
    }

    private void writeProjectionsCsv(BandPlotData data, String viewName) throws IOException {
        Path file = outputDir.resolve(buildFileName(viewName, "projections"));
        int[] bands = data.getBandIndices();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("segment", "band", "point", "distance", "energy", "channel",
                                "label", "value")
                        .build().print(w)) {

            for (SegmentPlotData segment : data.getSegments()) {
                int segmentNo = signedSegment(segment);
                double[] d = segment.getDistances();
                for (int c = 0; c < segment.getChannels().size(); c++) {
                    double[][] weights = segment.getChannels().get(c);
                    String label = data.getChannelLabels().get(c);
                    for (int b = 0; b < bands.length; b++) {
                        for (int p = 0; p < d.length; p++) {
                            pr.printRecord(segmentNo, bands[b], p, d[p],
                                    segment.getEnergies()[b][p], c, label, weights[b][p]);
                        }
                    }
                }
            }
        }
    }

    private void writeTicksCsv(BandPlotData data, String viewName) throws IOException {
        Path file = outputDir.resolve(buildFileName(viewName, "ticks"));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("index", "distance", "label").build().print(w)) {
            for (TickMark tick : data.getTicks()) {
                pr.printRecord(tick.getIndex(), tick.getPosition(), tick.getLabel());
            }
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code band_elements_ticks.csv}
     * </p>
     *
     * @param viewName 表示の種類です
     * @param kind 内容の識別子（bands/projections/ticks）
     * @return ファイル名です
     */
    static String buildFileName(String viewName, String kind) {
        return FILE_HEAD + "_" + viewName + "_" + kind + ".csv";
    }

    private static int signedSegment(SegmentPlotData segment) {
        int no = segment.getSegmentId() + 1;
        return segment.isReversed() ? -no : no;
    }

    private static Object valueOrEmpty(double[][] values, int b, int p) {
        return values == null ? "" : values[b][p];
    }
}
