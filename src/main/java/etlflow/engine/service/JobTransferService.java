package etlflow.engine.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import etlflow.engine.model.Job;
import etlflow.engine.repository.DependencyRepository;
import etlflow.engine.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Exports job definitions to a JSON array and imports them back as new jobs.
 */
public class JobTransferService {

    private static final Logger log = LoggerFactory.getLogger(JobTransferService.class);
    private static final TypeReference<List<JobDefinition>> DEFINITIONS = new TypeReference<>() {
    };

    private final JobService jobService;
    private final JobRepository jobRepository;
    private final DependencyRepository dependencyRepository;
    private final ObjectMapper mapper;

    public JobTransferService(JobService jobService, JobRepository jobRepository,
            DependencyRepository dependencyRepository) {
        this.jobService = jobService;
        this.jobRepository = jobRepository;
        this.dependencyRepository = dependencyRepository;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * All jobs as export records, ordered by name.
     */
    public List<JobDefinition> exportDefinitions() {
        List<Job> jobs = jobRepository.findAll();
        Map<String, String> names = new HashMap<>();
        for (Job job : jobs) {
            names.put(job.id(), job.name());
        }

        List<JobDefinition> definitions = new ArrayList<>();
        for (Job job : jobs) {
            List<String> dependsOn = new ArrayList<>();
            for (String prerequisiteId : dependencyRepository.findPrerequisites(job.id())) {
                dependsOn.add(names.getOrDefault(prerequisiteId, prerequisiteId));
            }
            definitions.add(JobDefinition.from(job, dependsOn));
        }
        return definitions;
    }

    public int exportJobs(Writer writer) throws IOException {
        List<JobDefinition> definitions = exportDefinitions();
        mapper.writeValue(writer, definitions);
        log.info("Exported {} jobs", definitions.size());
        return definitions.size();
    }

    public int exportJobs(Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            return exportJobs(writer);
        }
    }

    /**
     * Create a new job for every record, then restore {@code depends_on} edges by name.
     * Edges naming an unknown job, or that would create a cycle, are skipped with a warning.
     *
     * @return the created jobs, in file order
     * @throws InvalidJobException on the first invalid record, naming its index; jobs created before it are kept
     */
    public List<Job> importDefinitions(List<JobDefinition> definitions) {
        List<Job> created = new ArrayList<>();
        for (int i = 0; i < definitions.size(); i++) {
            try {
                created.add(jobService.create(definitions.get(i).toJob()));
            } catch (InvalidJobException e) {
                throw new InvalidJobException("Import record " + i + ": " + e.getMessage(), e);
            }
        }

        for (int i = 0; i < definitions.size(); i++) {
            List<String> dependsOn = definitions.get(i).dependsOn();
            if (dependsOn == null) {
                continue;
            }
            Job job = created.get(i);
            for (String prerequisiteName : dependsOn) {
                Optional<Job> prerequisite = jobRepository.findByName(prerequisiteName);
                if (prerequisite.isEmpty()) {
                    log.warn("Import: job {} depends on unknown job {}, edge skipped", job.name(), prerequisiteName);
                    continue;
                }
                try {
                    jobService.addDependency(job.id(), prerequisite.get().id());
                } catch (DependencyCycleException e) {
                    log.warn("Import: {}, edge skipped", e.getMessage());
                }
            }
        }

        log.info("Imported {} jobs", created.size());
        return created;
    }

    public List<Job> importJobs(Reader reader) throws IOException {
        return importDefinitions(mapper.readValue(reader, DEFINITIONS));
    }

    public List<Job> importJobs(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return importJobs(reader);
        }
    }
}
