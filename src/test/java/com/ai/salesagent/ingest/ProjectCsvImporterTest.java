package com.ai.salesagent.ingest;

import com.ai.salesagent.entity.Project;
import com.ai.salesagent.repository.ProjectRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.io.StringReader;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(ProjectCsvImporter.class)
class ProjectCsvImporterTest {

    private static final String HEADER = "Project Name,Bedrooms,Bathrooms,Completion Status,Unit Type,Developer Name,"
            + "Price,Area (sqm),Property Type,City,Country,Completion Date,Features,Facilities,Description\n";

    @Autowired
    private ProjectCsvImporter importer;

    @Autowired
    private ProjectRepository projectRepository;

    @Test
    void importsRowsAndSkipsNameless() throws Exception {
        String csv = HEADER
                + "Marina Heights,2,2,off_plan,2BR,Emaar,\"$450,000\",110.5,Apartment,Dubai,AE,2026-12,"
                + "\"[\"\"Balcony\"\",\"\"Sea view\"\"]\",\"Pool, Gym\",Waterfront living\n"
                + ",3,2,ready,3BR,Nobody,100000,90,villa,Bali,ID,,,,\n"
                + "Ubud Retreat,abc,,ready,,,,,VILLA,Bali,ID,,,,\n";

        ProjectCsvImporter.ImportResult result = importer.importCsv(new StringReader(csv), false);

        assertThat(result.getCreated()).isEqualTo(2);
        assertThat(result.getUpdated()).isZero();
        assertThat(result.getSkipped()).isEqualTo(1);

        Project marina = projectRepository.findByProjectName("Marina Heights").orElseThrow();
        assertThat(marina.getPriceUsd()).isEqualTo(450_000d);
        assertThat(marina.getAreaSqm()).isEqualTo(110.5d);
        assertThat(marina.getPropertyType()).isEqualTo("apartment");
        assertThat(marina.getFeatures()).containsExactly("Balcony", "Sea view");
        assertThat(marina.getFacilities()).containsExactly("Pool", "Gym");

        Project ubud = projectRepository.findByProjectName("Ubud Retreat").orElseThrow();
        assertThat(ubud.getBedrooms()).isNull();
        assertThat(ubud.getPriceUsd()).isNull();
        assertThat(ubud.getPropertyType()).isEqualTo("villa");
    }

    @Test
    void reimportUpdatesByName() throws Exception {
        importer.importCsv(new StringReader(HEADER + "Creek Views,1,1,ready,1BR,Dev,380000,60,apartment,Dubai,AE,,,,\n"), false);

        ProjectCsvImporter.ImportResult result = importer.importCsv(
                new StringReader(HEADER + "Creek Views,1,1,ready,1BR,Dev,395000,60,apartment,Dubai,AE,,,,\n"), false);

        assertThat(result.getCreated()).isZero();
        assertThat(result.getUpdated()).isEqualTo(1);
        assertThat(projectRepository.count()).isEqualTo(1);
        assertThat(projectRepository.findByProjectName("Creek Views").orElseThrow().getPriceUsd()).isEqualTo(395_000d);
    }

    @Test
    void clearRemovesExistingProjects() throws Exception {
        projectRepository.saveAndFlush(Project.builder().projectName("Old Tower").city("Doha").build());

        importer.importCsv(new StringReader(HEADER + "New Tower,2,2,ready,,,500000,,apartment,Doha,QA,,,,\n"), true);

        assertThat(projectRepository.findByProjectName("Old Tower")).isEmpty();
        assertThat(projectRepository.findByProjectName("New Tower")).isPresent();
    }

    @Test
    void parsesLooseValues() {
        assertThat(ProjectCsvImporter.parsePrice("$1,250,000")).isEqualTo(1_250_000d);
        assertThat(ProjectCsvImporter.parsePrice("on request")).isNull();
        assertThat(ProjectCsvImporter.parseInteger("2.5")).isNull();
        assertThat(ProjectCsvImporter.parseList("['Gym', 'Spa']")).containsExactly("Gym", "Spa");
        assertThat(ProjectCsvImporter.parseList("  ")).isEmpty();
    }
}
