package com.touristtax.reservation.domain.tax;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Static table of tourist tax rates for supported Polish cities.
 * <p>
 * Lookups ignore case, surrounding whitespace and Polish diacritics, so
 * "Kraków", "krakow" and " KRAKOW " resolve to the same entry.
 */
@Component
public class TaxRateTable {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final List<CityTaxRate> RATES = List.of(
            CityTaxRate.pln("Kraków", "Małopolskie", "2.50"),
            CityTaxRate.pln("Warszawa", "Mazowieckie", "3.00", "Warsaw"),
            CityTaxRate.pln("Gdańsk", "Pomorskie", "2.80"),
            CityTaxRate.pln("Wrocław", "Dolnośląskie", "2.30"),
            CityTaxRate.pln("Poznań", "Wielkopolskie", "2.20"),
            CityTaxRate.pln("Zakopane", "Małopolskie", "3.50"),
            CityTaxRate.pln("Karpacz", "Dolnośląskie", "2.00"),
            CityTaxRate.pln("Szklarska Poręba", "Dolnośląskie", "2.00"),
            CityTaxRate.pln("Sopot", "Pomorskie", "3.20"),
            CityTaxRate.pln("Gdynia", "Pomorskie", "2.50"),
            CityTaxRate.pln("Kołobrzeg", "Zachodniopomorskie", "2.80"),
            CityTaxRate.pln("Świnoujście", "Zachodniopomorskie", "2.60"),
            CityTaxRate.pln("Lublin", "Lubelskie", "2.00"),
            CityTaxRate.pln("Toruń", "Kujawsko-Pomorskie", "2.10"),
            CityTaxRate.pln("Częstochowa", "Śląskie", "1.80"),
            CityTaxRate.pln("Łódź", "Łódzkie", "2.00"),
            CityTaxRate.pln("Katowice", "Śląskie", "2.10"),
            CityTaxRate.pln("Bydgoszcz", "Kujawsko-Pomorskie", "1.90"),
            CityTaxRate.pln("Szczecin", "Zachodniopomorskie", "2.20")
    );

    private final Map<String, CityTaxRate> byNormalizedName;
    private final List<CityTaxRate> sortedRates;

    public TaxRateTable() {
        Map<String, CityTaxRate> index = new LinkedHashMap<>();
        for (CityTaxRate rate : RATES) {
            index.put(normalize(rate.cityName()), rate);
            rate.aliases().forEach(alias -> index.put(normalize(alias), rate));
        }
        this.byNormalizedName = Collections.unmodifiableMap(index);
        this.sortedRates = RATES.stream()
                .sorted(Comparator.comparing(rate -> normalize(rate.cityName())))
                .toList();
    }

    public Optional<CityTaxRate> find(String cityName) {
        if (cityName == null || cityName.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(byNormalizedName.get(normalize(cityName)));
    }

    /** Every supported city, sorted by name with diacritics ignored. */
    public List<CityTaxRate> all() {
        return sortedRates;
    }

    public List<String> supportedCityNames() {
        return sortedRates.stream().map(CityTaxRate::cityName).toList();
    }

    static String normalize(String name) {
        // ł has no decomposition, so it survives NFD and is mapped by hand
        String lowered = name.trim().toLowerCase(Locale.ROOT).replace('ł', 'l');
        String decomposed = Normalizer.normalize(lowered, Normalizer.Form.NFD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ");
    }
}
