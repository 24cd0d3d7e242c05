package io.github.yok.band.core.projection;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * 集計済みの射影重み {@code [band][k][channel]} と、チャネルごとの凡例ラベルです。
 *
 * <p>
 * チャネルの並びは選択子の指定順で、凡例の並びと一致します。
 * </p>
 */
public final class ProjectionChannels {

    private final double[][][] values;

    private final ImmutableList<String> labels;

    /**
     * 集計結果を生成します。
     *
     * @param values {@code [band][k][channel]} の重みです（所有権を引き取ります）
     * @param labels チャネルごとのラベルです
     * @throws IllegalArgumentException チャネル数とラベル数が一致しない場合に発生します
     */
    public ProjectionChannels(double[][][] values, List<String> labels) {
        Preconditions.checkNotNull(values, "values は null 不可です");
        Preconditions.checkNotNull(labels, "labels は null 不可です");
        for (double[][] band : values) {
            for (double[] k : band) {
                Preconditions.checkArgument(k.length == labels.size(),
                        "チャネル数とラベル数が一致しません: %s vs %s", k.length, labels.size());
            }
        }
        this.values = values;
        this.labels = ImmutableList.copyOf(labels);
    }

    public int bandCount() {
        return values.length;
    }

    public int kpointCount() {
        return values.length == 0 ? 0 : values[0].length;
    }

    public int channelCount() {
        return labels.size();
    }

    public ImmutableList<String> labels() {
        return labels;
    }

    /**
     * 重みを返します。
     *
     * @param band バンドです
     * @param k k 点です
     * @param channel チャネルです
     * @return 重みです
     */
    public double value(int band, int k, int channel) {
        return values[band][k][channel];
    }

    /**
     * 1 チャネル分の重みを {@code [band][k]} で返します（コピーです）。
     *
     * @param channel チャネルです
     * @return 重みです
     */
    public double[][] channel(int channel) {
        Preconditions.checkElementIndex(channel, channelCount(), "channel");
        double[][] out = new double[bandCount()][kpointCount()];
        for (int b = 0; b < out.length; b++) {
            for (int k = 0; k < out[b].length; k++) {
                out[b][k] = values[b][k][channel];
            }
        }
        return out;
    }
}
