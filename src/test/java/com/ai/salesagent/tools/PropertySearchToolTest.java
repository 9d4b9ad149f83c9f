package com.ai.salesagent.tools;

import com.ai.salesagent.conversation.PropertyMatch;
import com.ai.salesagent.entity.Project;
import com.ai.salesagent.repository.ProjectRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(PropertySearchTool.class)
class PropertySearchToolTest {

    @Autowired
    private PropertySearchTool tool;

    @Autowired
    private ProjectRepository projectRepository;

    @BeforeEach
    void seed() {
        projectRepository.saveAll(List.of(
                project("Marina Heights", "Dubai", "AE", 450_000d, 2, "apartment"),
                project("Palm Villas", "Dubai", "AE", 1_200_000d, 4, "villa"),
                project("Creek Views", "Dubai", "AE", 380_000d, 1, "apartment"),
                project("Ubud Retreat", "Bali", "ID", 300_000d, 2, "villa"),
                project("Unpriced Lofts", "Dubai", "AE", null, 2, "apartment")));
        projectRepository.flush();
    }

    private static Project project(String name, String city, String country, Double price, int beds, String type) {
        return Project.builder()
                .projectName(name)
                .city(city)
                .country(country)
                .priceUsd(price)
                .bedrooms(beds)
                .propertyType(type)
                .description("A lovely " + type + " in " + city)
                .build();
    }

    @Test
    void filtersByCityAndOrdersByPrice() {
        List<PropertyMatch> results = tool.searchProperties("dubai", null, null, null, null, 5);

        assertThat(results).extracting(PropertyMatch::getProjectName)
                .containsExactly("Creek Views", "Marina Heights", "Palm Villas");
    }

    @Test
    void cityTermAlsoMatchesCountryCode() {
        List<PropertyMatch> results = tool.searchProperties("ID", null, null, null, null, 5);

        assertThat(results).extracting(PropertyMatch::getProjectName).containsExactly("Ubud Retreat");
    }

    @Test
    void appliesBudgetBedroomsAndType() {
        List<PropertyMatch> results = tool.searchProperties("Dubai", 400_000d, 500_000d, 2, "Apartment", 5);

        assertThat(results).singleElement().satisfies(match -> {
            assertThat(match.getProjectName()).isEqualTo("Marina Heights");
            assertThat(match.getPriceUsd()).isEqualTo(450_000d);
            assertThat(match.getBedrooms()).isEqualTo(2);
            assertThat(match.getId()).isNotBlank();
            assertThat(match.getDescription()).isEqualTo("A lovely apartment in Dubai");
        });
    }

    @Test
    void zeroBoundsAreIgnoredAndLimitApplies() {
        List<PropertyMatch> results = tool.searchProperties(null, 0d, 0d, 0, " ", 2);

        assertThat(results).extracting(PropertyMatch::getProjectName).containsExactly("Ubud Retreat", "Creek Views");
    }

    @Test
    void noMatchesGivesEmptyList() {
        assertThat(tool.searchProperties("Tokyo", null, null, null, null, 5)).isEmpty();
    }

    @Test
    void projectDetailsBySubstring() {
        Optional<Map<String, Object>> details = tool.getProjectDetails("palm");

        assertThat(details).isPresent();
        assertThat(details.get()).containsEntry("project_name", "Palm Villas").containsKey("id");
        assertThat(details.get().get("id")).isInstanceOf(String.class);
        assertThat(tool.getProjectDetails("nothing like this")).isEmpty();
    }

    @Test
    void citiesAndPriceRange() {
        assertThat(tool.getCities()).containsExactly("Bali", "Dubai");

        PropertySearchTool.PriceRange dubai = tool.getPriceRange("Dubai");
        assertThat(dubai.getMinPrice()).isEqualTo(380_000d);
        assertThat(dubai.getMaxPrice()).isEqualTo(1_200_000d);
        assertThat(dubai.getAvgPrice()).isCloseTo(676_666.67d, within(0.01));
    }
}
