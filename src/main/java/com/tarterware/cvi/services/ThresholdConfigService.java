package com.tarterware.cvi.services;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tarterware.cvi.exceptions.ThresholdConfigException;
import com.tarterware.cvi.models.ThresholdBin;
import com.tarterware.cvi.models.ThresholdTable;
import com.tarterware.cvi.models.ThresholdTableSet;
import com.tarterware.cvi.models.config.ClassSpec;
import com.tarterware.cvi.models.config.CviConfig;
import com.tarterware.cvi.models.config.DimensionConfig;
import com.tarterware.cvi.models.config.PaletteEntry;
import com.tarterware.cvi.utilities.StringUtilities;

import jakarta.annotation.PostConstruct;

/**
 * Loads the scoring configuration document and turns it into validated,
 * strongly typed {@link ThresholdTable}s.
 *
 * <p>
 * Validation fails fast with a {@link ThresholdConfigException}; a malformed
 * bin is never dropped. The checks are:
 * <ul>
 * <li>the palette and the {@code total_cvi} section are present;</li>
 * <li>every dimension has at least one class;</li>
 * <li>ranks are integers and unique within a dimension;</li>
 * <li>labels are not blank;</li>
 * <li>every class resolves to a color, through its palette reference, a
 * literal color, or the palette entry of its rank, in that order;</li>
 * <li>{@code min < max}, where a missing bound is unbounded;</li>
 * <li>category codes are not null.</li>
 * </ul>
 * </p>
 */
@Service
public class ThresholdConfigService
{
    // Location of the scoring configuration, in Spring resource syntax.
    @Value("${com.tarterware.cvi.config-location:classpath:cvi-config.json}")
    private String configLocation;

    private final ResourceLoader resourceLoader;

    private final ObjectMapper objectMapper;

    private volatile ThresholdTableSet tableSet;

    private static final Logger logger = LoggerFactory.getLogger(ThresholdConfigService.class);

    public ThresholdConfigService(ResourceLoader resourceLoader, ObjectMapper objectMapper)
    {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init()
    {
        this.tableSet = loadTableSet(configLocation);

        logger.info("Loaded threshold tables for dimensions {} from {}", tableSet.getDimensions(), configLocation);
    }

    /**
     * @return The tables loaded at start-up.
     */
    public ThresholdTableSet getTableSet()
    {
        if (tableSet == null)
        {
            throw new IllegalStateException("Threshold tables have not been loaded!");
        }
        return tableSet;
    }

    /**
     * Read and validate the configuration at the given location.
     *
     * @param location Spring resource location, e.g. "classpath:cvi-config.json".
     * @return The validated tables.
     * @throws ThresholdConfigException if the document is missing, unparsable or
     *                                  invalid.
     */
    public ThresholdTableSet loadTableSet(String location)
    {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists())
        {
            throw new ThresholdConfigException("Threshold configuration not found: " + location);
        }

        CviConfig config;
        try (InputStream inputStream = resource.getInputStream())
        {
            config = objectMapper.readValue(inputStream, CviConfig.class);
        }
        catch (IOException e)
        {
            throw new ThresholdConfigException("Unable to read threshold configuration " + location, e);
        }

        return buildTableSet(config);
    }

    /**
     * Build validated tables from a parsed configuration document.
     *
     * @param config Parsed configuration.
     * @return Dimension tables in document order, plus the composite table.
     */
    public ThresholdTableSet buildTableSet(CviConfig config)
    {
        if (config == null)
        {
            throw new ThresholdConfigException("Threshold configuration is empty!");
        }
        if (config.getMeta() == null || config.getMeta().getDefaultPalette() == null
                || config.getMeta().getDefaultPalette().isEmpty())
        {
            throw new ThresholdConfigException("Threshold configuration has no meta.default_palette!");
        }

        Map<String, PaletteEntry> palette = config.getMeta().getDefaultPalette();

        DimensionConfig compositeConfig = config.getDimensions().get(CviConfig.COMPOSITE_DIMENSION);
        if (compositeConfig == null)
        {
            throw new ThresholdConfigException(
                    "Threshold configuration has no " + CviConfig.COMPOSITE_DIMENSION + " section!");
        }
        ThresholdTable compositeTable = buildTable(CviConfig.COMPOSITE_DIMENSION, compositeConfig, palette);

        Map<String, ThresholdTable> dimensionTables = new LinkedHashMap<>();
        for (Map.Entry<String, DimensionConfig> entry : config.getDimensions().entrySet())
        {
            if (CviConfig.COMPOSITE_DIMENSION.equals(entry.getKey()))
            {
                continue;
            }
            dimensionTables.put(entry.getKey(), buildTable(entry.getKey(), entry.getValue(), palette));
        }

        return new ThresholdTableSet(dimensionTables, compositeTable);
    }

    ThresholdTable buildTable(String dimension, DimensionConfig dimensionConfig, Map<String, PaletteEntry> palette)
    {
        if (dimensionConfig == null || dimensionConfig.getEntries() == null
                || dimensionConfig.getEntries().isEmpty())
        {
            throw new ThresholdConfigException("Dimension " + dimension + " has no classes!");
        }

        List<ThresholdBin> bins = new ArrayList<>();
        Set<Integer> ranks = new HashSet<>();
        for (Map.Entry<String, ClassSpec> entry : dimensionConfig.getEntries().entrySet())
        {
            Integer rank = StringUtilities.parseIntegerOrNull(entry.getKey());
            if (rank == null)
            {
                throw new ThresholdConfigException(
                        "Dimension " + dimension + " has a non-integer rank: \"" + entry.getKey() + "\"");
            }
            if (!ranks.add(rank))
            {
                throw new ThresholdConfigException("Dimension " + dimension + " repeats rank " + rank);
            }

            ClassSpec spec = entry.getValue();
            if (spec == null)
            {
                throw new ThresholdConfigException("Dimension " + dimension + " rank " + rank + " is empty!");
            }
            if (StringUtilities.isNullEmptyOrBlank(spec.getLabel()))
            {
                throw new ThresholdConfigException("Dimension " + dimension + " rank " + rank + " has no label!");
            }

            double min = spec.getMin() == null ? Double.NEGATIVE_INFINITY : spec.getMin();
            double max = spec.getMax() == null ? Double.POSITIVE_INFINITY : spec.getMax();
            if (Double.isNaN(min) || Double.isNaN(max) || !(min < max))
            {
                throw new ThresholdConfigException(
                        "Dimension " + dimension + " rank " + rank + " has min " + min + " not below max " + max);
            }

            String color = resolveColor(dimension, rank, spec, palette);

            Set<Integer> codes = new HashSet<>();
            if (spec.getCodes() != null)
            {
                for (Integer code : spec.getCodes())
                {
                    if (code == null)
                    {
                        throw new ThresholdConfigException(
                                "Dimension " + dimension + " rank " + rank + " lists a null category code!");
                    }
                    codes.add(code);
                }
            }

            bins.add(new ThresholdBin(rank, min, max, spec.getLabel().trim(), color, codes));
        }

        Map<Integer, Integer> rescale = new LinkedHashMap<>();
        if (dimensionConfig.getRescale() != null)
        {
            for (Map.Entry<String, Integer> entry : dimensionConfig.getRescale().entrySet())
            {
                Integer from = StringUtilities.parseIntegerOrNull(entry.getKey());
                if (from == null || entry.getValue() == null)
                {
                    throw new ThresholdConfigException("Dimension " + dimension + " has an invalid rescale entry "
                            + entry.getKey() + " -> " + entry.getValue());
                }
                rescale.put(from, entry.getValue());
            }
        }

        return new ThresholdTable(dimension, bins, rescale);
    }

    private String resolveColor(String dimension, int rank, ClassSpec spec, Map<String, PaletteEntry> palette)
    {
        String reference = spec.getPalette();
        if (StringUtilities.isNullEmptyOrBlank(reference))
        {
            if (!StringUtilities.isNullEmptyOrBlank(spec.getColor()))
            {
                return spec.getColor().trim();
            }
            reference = Integer.toString(rank);
        }

        PaletteEntry paletteEntry = palette.get(reference.trim());
        if (paletteEntry == null || StringUtilities.isNullEmptyOrBlank(paletteEntry.getColor()))
        {
            throw new ThresholdConfigException("Dimension " + dimension + " rank " + rank
                    + " references palette entry \"" + reference + "\" which has no color!");
        }
        return paletteEntry.getColor().trim();
    }
}
