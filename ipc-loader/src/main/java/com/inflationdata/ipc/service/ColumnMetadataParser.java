package com.inflationdata.ipc.service;

import com.inflationdata.ipc.model.CategoryNames;
import com.inflationdata.ipc.model.ColumnMetadata;
import com.inflationdata.ipc.model.Region;
import com.inflationdata.ipc.model.SeriesKey;
import com.inflationdata.ipc.model.TaxonomyAxis;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decodes datos.gob.ar series column names into (region, category, classification).
 *
 * Grammar (snake_case, accents optional):
 *   [noise tokens] series tokens [region token]
 *   e.g. alimentos_y_bebidas_no_alcoholicas_noa, ipc_nucleo_gba, nivel_general
 *
 * A column without a region token is the national series. The period column and
 * other bookkeeping columns come back as {@link ColumnMetadata.Metadata}.
 */
@Component
public class ColumnMetadataParser {

    private static final Set<String> METADATA_COLUMNS = Set.of(
            "indice_tiempo", "fecha", "periodo", "mes", "date", "period");

    /** Tokens that qualify a series without identifying it */
    private static final Set<String> NOISE_TOKENS = Set.of(
            "ipc", "incidencia", "inc", "absoluta", "mensual", "indice", "var", "variacion",
            "base", "dic", "diciembre", "region", "y", "de", "del", "la", "el");

    private record Rule(String classification, List<String> stems) {
        static Rule of(String classification, String... stems) {
            return new Rule(classification, List.of(stems));
        }
    }

    // Order matters: "no alcoholicas" must hit food before the alcohol rule,
    // "otros combustibles" must hit housing before the miscellaneous rule.
    private static final List<Rule> DIVISION_RULES = List.of(
            Rule.of("Alimentos y bebidas", "alimento"),
            Rule.of("Bebidas alcohólicas y tabaco", "alcohol", "tabaco"),
            Rule.of("Prendas de vestir y calzado", "prenda", "vestir", "calzado"),
            Rule.of("Vivienda y servicios básicos", "vivienda", "agua", "electricidad", "combustible"),
            Rule.of("Equipamiento del hogar", "equipamiento", "mantenimiento"),
            Rule.of("Salud", "salud"),
            Rule.of("Transporte", "transporte"),
            Rule.of("Comunicación", "comunicacion"),
            Rule.of("Recreación y cultura", "recreacion", "cultura"),
            Rule.of("Educación", "educacion"),
            Rule.of("Restaurantes y hoteles", "restaurante", "hotel"),
            Rule.of("Bienes y servicios varios", "otros", "varios"));

    private static final List<Rule> ANALYTICAL_RULES = List.of(
            Rule.of("Núcleo", "nucleo"),
            Rule.of("Regulados", "regulado"),
            Rule.of("Estacionales", "estacional"));

    public ColumnMetadata parse(String columnName, TaxonomyAxis axis) {
        if (columnName == null || columnName.isBlank()) {
            return new ColumnMetadata.Unparseable(String.valueOf(columnName), "blank column name");
        }

        String normalised = normalise(columnName);
        if (METADATA_COLUMNS.contains(normalised)) {
            return new ColumnMetadata.Metadata(columnName);
        }

        List<String> tokens = new ArrayList<>(Arrays.asList(normalised.split("_+")));
        tokens.removeIf(t -> t.isEmpty() || NOISE_TOKENS.contains(t) || t.chars().allMatch(Character::isDigit));

        Region found = Region.NACIONAL;
        List<String> seriesTokens = new ArrayList<>();
        for (String token : tokens) {
            Optional<Region> match = Region.fromToken(token);
            if (match.isPresent()) {
                found = match.get();
            } else {
                seriesTokens.add(token);
            }
        }
        Region region = found;

        if (seriesTokens.isEmpty()) {
            return new ColumnMetadata.Unparseable(columnName, "no series tokens");
        }

        if (isHeadline(seriesTokens)) {
            return parsed(region, CategoryNames.HEADLINE, CategoryNames.HEADLINE_CLASSIFICATION);
        }

        return switch (axis) {
            case DIVISION -> matchRule(DIVISION_RULES, seriesTokens)
                    .map(c -> parsed(region, CategoryNames.DIVISION, c))
                    // Unknown divisions stay parsed so the nature table can flag the drift
                    .orElseGet(() -> parsed(region, CategoryNames.DIVISION, humanise(seriesTokens)));
            case ANALYTICAL -> matchRule(ANALYTICAL_RULES, seriesTokens)
                    .map(c -> parsed(region, CategoryNames.ANALYTICAL, c))
                    .orElseGet(() -> unparseable(columnName, axis));
            case NATURE -> natureClassification(seriesTokens)
                    .map(c -> parsed(region, CategoryNames.NATURE, c))
                    .orElseGet(() -> unparseable(columnName, axis));
        };
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private boolean isHeadline(List<String> tokens) {
        return tokens.contains("nivel") && tokens.contains("general");
    }

    private Optional<String> natureClassification(List<String> tokens) {
        boolean goods = hasStem(tokens, "bien");
        boolean services = hasStem(tokens, "servicio");
        if (goods && !services) return Optional.of("Bienes");
        if (services && !goods) return Optional.of("Servicios");
        return Optional.empty();
    }

    private Optional<String> matchRule(List<Rule> rules, List<String> tokens) {
        return rules.stream()
                .filter(rule -> rule.stems().stream().anyMatch(stem -> hasStem(tokens, stem)))
                .map(Rule::classification)
                .findFirst();
    }

    private boolean hasStem(List<String> tokens, String stem) {
        return tokens.stream().anyMatch(t -> t.startsWith(stem));
    }

    private ColumnMetadata parsed(Region region, String categoryName, String classification) {
        return new ColumnMetadata.Parsed(new SeriesKey(region.displayName(), categoryName, classification));
    }

    private ColumnMetadata unparseable(String columnName, TaxonomyAxis axis) {
        return new ColumnMetadata.Unparseable(columnName, "no " + axis + " classification matches");
    }

    private String normalise(String name) {
        String stripped = Normalizer.normalize(name.trim(), Normalizer.Form.NFD)
                .replaceAll("\\p{M}", "");
        return stripped.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_").replaceAll("^_|_$", "");
    }

    private String humanise(List<String> tokens) {
        String joined = tokens.stream().collect(Collectors.joining(" "));
        return Character.toUpperCase(joined.charAt(0)) + joined.substring(1);
    }
}
