package com.propertyintel.housekeeping.output;

import com.propertyintel.housekeeping.model.ChartSpec;
import lombok.extern.slf4j.Slf4j;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.CategoryLabelPositions;
import org.jfree.chart.plot.CategoryPlot;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.data.category.DefaultCategoryDataset;
import org.springframework.stereotype.Component;

import java.awt.AWTError;
import java.awt.Color;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rasterizes chart specs to PNG with JFreeChart.
 *
 * A chart that fails to render is logged and skipped; the rest of the report
 * is still written and the HTML only references charts that exist.
 */
@Component
@Slf4j
public class ChartRenderer {

    static final int WIDTH = 1000;
    static final int HEIGHT = 500;

    public List<Path> render(List<ChartSpec> charts, Path outputDir) {
        List<Path> written = new ArrayList<>();
        for (ChartSpec spec : charts) {
            Path target = outputDir.resolve(spec.getFileName());
            try {
                ChartUtils.saveChartAsPNG(target.toFile(), build(spec), WIDTH, HEIGHT);
                written.add(target);
            } catch (Exception | AWTError | LinkageError e) {
                log.warn("Could not render chart '{}' to {}: {}", spec.getTitle(), target, e.getMessage());
            }
        }
        log.info("Rendered {}/{} charts", written.size(), charts.size());
        return written;
    }

    JFreeChart build(ChartSpec spec) {
        DefaultCategoryDataset dataset = new DefaultCategoryDataset();
        for (Map.Entry<String, List<Number>> series : spec.getSeries().entrySet()) {
            List<Number> values = series.getValue();
            for (int i = 0; i < spec.getCategories().size() && i < values.size(); i++) {
                dataset.addValue(values.get(i), series.getKey(), spec.getCategories().get(i));
            }
        }

        boolean legend = spec.getSeries().size() > 1;
        JFreeChart chart = switch (spec.getKind()) {
            case LINE -> ChartFactory.createLineChart(spec.getTitle(), spec.getCategoryAxisLabel(),
                    spec.getValueAxisLabel(), dataset, PlotOrientation.VERTICAL, legend, false, false);
            case HORIZONTAL_BAR -> ChartFactory.createBarChart(spec.getTitle(), spec.getCategoryAxisLabel(),
                    spec.getValueAxisLabel(), dataset, PlotOrientation.HORIZONTAL, legend, false, false);
            case BAR -> ChartFactory.createBarChart(spec.getTitle(), spec.getCategoryAxisLabel(),
                    spec.getValueAxisLabel(), dataset, PlotOrientation.VERTICAL, legend, false, false);
        };

        CategoryPlot plot = chart.getCategoryPlot();
        plot.setBackgroundPaint(Color.WHITE);
        plot.setRangeGridlinePaint(Color.LIGHT_GRAY);
        if (spec.getKind() != ChartSpec.Kind.HORIZONTAL_BAR) {
            plot.getDomainAxis().setCategoryLabelPositions(CategoryLabelPositions.UP_45);
        }
        return chart;
    }
}
