package dev.minibook.service;

import dev.minibook.config.GitHubProperties;
import dev.minibook.domain.entity.Agent;
import dev.minibook.domain.entity.Post;
import dev.minibook.domain.valueobject.Actor;
import dev.minibook.exception.NotFoundException;
import dev.minibook.infrastructure.github.GitHubEventPayload;
import dev.minibook.pipeline.EventPipeline;
import dev.minibook.repository.AgentRepository;
import dev.minibook.repository.PostRepository;
import dev.minibook.repository.ProjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Mirrors GitHub issues and pull requests into a project as posts authored
 * by the bot agent. Opening creates a post, closing sets its status to
 * {@code closed}. Bridged posts are found again through their
 * {@code github:<repo>#<number>} tag.
 */
@Service
public class GitHubBridgeService {

    private static final Logger log = LoggerFactory.getLogger(GitHubBridgeService.class);

    static final String ISSUE_TYPE = "github-issue";
    static final String PR_TYPE = "github-pr";
    static final String CLOSED = "closed";
    static final String OPEN = "open";
    static final int MAX_TITLE = 500;
    static final int MAX_CONTENT = 20_000;

    public enum Outcome { CREATED, REOPENED, CLOSED, IGNORED }

    public record Result(Outcome outcome, UUID postId) {
        static Result ignored() {
            return new Result(Outcome.IGNORED, null);
        }
    }

    private final ProjectRepository projectRepository;
    private final AgentRepository agentRepository;
    private final PostRepository postRepository;
    private final EventPipeline pipeline;
    private final GitHubProperties properties;
    private final TransactionTemplate botTransaction;

    public GitHubBridgeService(ProjectRepository projectRepository,
                               AgentRepository agentRepository,
                               PostRepository postRepository,
                               EventPipeline pipeline,
                               GitHubProperties properties,
                               PlatformTransactionManager transactionManager) {
        this.projectRepository = projectRepository;
        this.agentRepository = agentRepository;
        this.postRepository = postRepository;
        this.pipeline = pipeline;
        this.properties = properties;
        this.botTransaction = new TransactionTemplate(transactionManager);
        this.botTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Transactional
    public Result bridge(UUID projectId, String eventType, GitHubEventPayload payload) {
        if (!projectRepository.existsById(projectId)) {
            throw NotFoundException.of("Project");
        }
        String type = switch (eventType) {
            case "issues" -> ISSUE_TYPE;
            case "pull_request" -> PR_TYPE;
            default -> null;
        };
        GitHubEventPayload.Item item = payload.item();
        if (type == null || item == null || payload.repository() == null) {
            return Result.ignored();
        }

        String repo = payload.repository().fullName();
        String marker = "github:" + repo + "#" + item.number();
        Optional<Post> existing = findBridged(projectId, marker);
        Actor bot = botActor();

        if (payload.isOpening()) {
            if (existing.isPresent()) {
                Post post = existing.get();
                setStatus(post, OPEN, bot);
                return new Result(Outcome.REOPENED, post.getId());
            }
            Post post = pipeline.runPostPipeline(bot, projectId, titleOf(type, item), contentOf(item),
                    type, List.of("github", repo, marker));
            log.info("Bridged {} {} into project {} as post {}", eventType, marker, projectId, post.getId());
            return new Result(Outcome.CREATED, post.getId());
        }
        if (payload.isClosing() && existing.isPresent()) {
            Post post = existing.get();
            setStatus(post, CLOSED, bot);
            return new Result(Outcome.CLOSED, post.getId());
        }
        log.debug("Ignoring {} action={} for {}", eventType, payload.action(), marker);
        return Result.ignored();
    }

    private void setStatus(Post post, String status, Actor bot) {
        String oldStatus = post.getStatus();
        post.changeStatus(status);
        pipeline.runStatusChangePipeline(post, oldStatus, status, bot);
    }

    private Optional<Post> findBridged(UUID projectId, String marker) {
        return postRepository.findByProjectIdAndTypeIn(projectId, List.of(ISSUE_TYPE, PR_TYPE)).stream()
                .filter(p -> p.getTags().contains(marker))
                .findFirst();
    }

    private Actor botActor() {
        String name = properties.botName();
        Agent bot = agentRepository.findByName(name).orElseGet(() -> createBot(name));
        return new Actor(bot.getId(), bot.getName());
    }

    /**
     * Creates the bot in its own transaction so that a concurrent delivery
     * creating it first leaves this transaction usable for the re-read.
     */
    private Agent createBot(String name) {
        try {
            Agent created = botTransaction.execute(status -> agentRepository.saveAndFlush(Agent.register(name)));
            log.info("Created GitHub bot agent '{}'", name);
            return created;
        } catch (DataIntegrityViolationException e) {
            log.debug("GitHub bot agent '{}' was created concurrently", name);
            return agentRepository.findByName(name)
                    .orElseThrow(() -> new IllegalStateException("GitHub bot agent '" + name + "' vanished"));
        }
    }

    private static String titleOf(String type, GitHubEventPayload.Item item) {
        String prefix = PR_TYPE.equals(type) ? "[PR #" : "[Issue #";
        String title = prefix + item.number() + "] " + (item.title() == null ? "" : item.title());
        return title.length() > MAX_TITLE ? title.substring(0, MAX_TITLE) : title;
    }

    private static String contentOf(GitHubEventPayload.Item item) {
        String body = item.body() == null ? "" : item.body();
        String content = item.htmlUrl() == null ? body
                : body.isEmpty() ? item.htmlUrl() : body + "\n\n" + item.htmlUrl();
        return content.length() > MAX_CONTENT ? content.substring(0, MAX_CONTENT) : content;
    }
}
