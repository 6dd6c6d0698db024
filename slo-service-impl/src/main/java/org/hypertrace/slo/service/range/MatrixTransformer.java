package org.hypertrace.slo.service.range;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.hypertrace.slo.service.prometheus.MatrixValue;
import org.hypertrace.slo.service.prometheus.SamplePair;
import org.hypertrace.slo.service.prometheus.SampleStream;

/**
 * Turns a matrix into columns for charting: row 0 holds the timestamps in seconds, row {@code i}
 * the values of stream {@code i - 1}. Streams of a matrix need not share timestamps, missing and
 * NaN values are reported as 0.
 */
public final class MatrixTransformer {

  private MatrixTransformer() {}

  public static double[][] toColumns(MatrixValue matrix) {
    List<SampleStream> streams = matrix.getStreams();
    if (streams.isEmpty()) {
      return new double[0][];
    }
    if (streams.size() == 1) {
      return singleStream(streams.get(0));
    }

    Map<Long, double[]> rows = new TreeMap<>();
    for (int i = 0; i < streams.size(); i++) {
      for (SamplePair pair : streams.get(i).getValues()) {
        double[] row = rows.computeIfAbsent(toSeconds(pair), t -> new double[streams.size()]);
        row[i] = valueOf(pair);
      }
    }

    double[][] columns = new double[streams.size() + 1][rows.size()];
    int index = 0;
    for (Map.Entry<Long, double[]> row : rows.entrySet()) {
      columns[0][index] = row.getKey();
      for (int i = 0; i < streams.size(); i++) {
        columns[i + 1][index] = row.getValue()[i];
      }
      index++;
    }
    return columns;
  }

  private static double[][] singleStream(SampleStream stream) {
    List<SamplePair> pairs = stream.getValues();
    double[][] columns = new double[2][pairs.size()];
    for (int i = 0; i < pairs.size(); i++) {
      columns[0][i] = toSeconds(pairs.get(i));
      columns[1][i] = valueOf(pairs.get(i));
    }
    return columns;
  }

  private static long toSeconds(SamplePair pair) {
    return pair.getTimestamp() / 1000;
  }

  private static double valueOf(SamplePair pair) {
    return Double.isNaN(pair.getValue()) ? 0 : pair.getValue();
  }
}
