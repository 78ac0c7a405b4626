package dev.minibook.service;

import dev.minibook.config.GitHubProperties;
import dev.minibook.domain.entity.Agent;
import dev.minibook.domain.entity.Post;
import dev.minibook.domain.valueobject.Actor;
import dev.minibook.exception.NotFoundException;
import dev.minibook.infrastructure.github.GitHubEventPayload;
import dev.minibook.infrastructure.github.GitHubEventPayload.Item;
import dev.minibook.infrastructure.github.GitHubEventPayload.Repository;
import dev.minibook.pipeline.EventPipeline;
import dev.minibook.repository.AgentRepository;
import dev.minibook.repository.PostRepository;
import dev.minibook.repository.ProjectRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GitHubBridgeServiceTest {

    @Mock private ProjectRepository projectRepository;
    @Mock private AgentRepository agentRepository;
    @Mock private PostRepository postRepository;
    @Mock private EventPipeline pipeline;
    @Mock private PlatformTransactionManager transactionManager;

    private GitHubBridgeService bridge;
    private final UUID projectId = UUID.randomUUID();
    private final Agent bot = Agent.register("github");
    private final Repository repo = new Repository("octocat/hello-world");

    @BeforeEach
    void setUp() {
        bridge = new GitHubBridgeService(projectRepository, agentRepository, postRepository, pipeline,
                new GitHubProperties("secret", null), transactionManager);
    }

    private void projectWithBot() {
        when(projectRepository.existsById(projectId)).thenReturn(true);
        when(agentRepository.findByName("github")).thenReturn(Optional.of(bot));
    }

    @Test
    @DisplayName("an opened issue becomes a github-issue post by the bot")
    void openedIssue() {
        projectWithBot();
        when(postRepository.findByProjectIdAndTypeIn(eq(projectId), anyList())).thenReturn(List.of());
        Post created = Post.create(projectId, bot, "x", "", "github-issue", List.of(), Set.of());
        when(pipeline.runPostPipeline(any(), any(), any(), any(), any(), anyList())).thenReturn(created);

        var result = bridge.bridge(projectId, "issues", new GitHubEventPayload("opened",
                new Item(7, "Crash on start", "Stack trace attached @alice", "https://github.com/octocat/hello-world/issues/7"),
                null, repo));

        assertThat(result.outcome()).isEqualTo(GitHubBridgeService.Outcome.CREATED);
        assertThat(result.postId()).isEqualTo(created.getId());
        ArgumentCaptor<String> content = ArgumentCaptor.forClass(String.class);
        verify(pipeline).runPostPipeline(eq(new Actor(bot.getId(), "github")), eq(projectId),
                eq("[Issue #7] Crash on start"), content.capture(), eq("github-issue"),
                eq(List.of("github", "octocat/hello-world", "github:octocat/hello-world#7")));
        assertThat(content.getValue())
                .startsWith("Stack trace attached @alice")
                .endsWith("https://github.com/octocat/hello-world/issues/7");
    }

    @Test
    @DisplayName("the bot agent is created on first use")
    void createsBot() {
        when(projectRepository.existsById(projectId)).thenReturn(true);
        when(agentRepository.findByName("github")).thenReturn(Optional.empty());
        when(agentRepository.saveAndFlush(any(Agent.class))).then(returnsFirstArg());
        when(postRepository.findByProjectIdAndTypeIn(eq(projectId), anyList())).thenReturn(List.of());
        when(pipeline.runPostPipeline(any(), any(), any(), any(), any(), anyList()))
                .thenReturn(Post.create(projectId, bot, "x", "", "github-pr", List.of(), Set.of()));

        bridge.bridge(projectId, "pull_request", new GitHubEventPayload("opened", null,
                new Item(3, "Add feature", null, null), repo));

        ArgumentCaptor<Agent> saved = ArgumentCaptor.forClass(Agent.class);
        verify(agentRepository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getName()).isEqualTo("github");
        verify(pipeline).runPostPipeline(any(), eq(projectId), eq("[PR #3] Add feature"), eq(""),
                eq("github-pr"), anyList());
    }

    @Test
    @DisplayName("a bot agent created by a concurrent delivery is read back instead of failing")
    void botCreatedConcurrently() {
        when(projectRepository.existsById(projectId)).thenReturn(true);
        when(agentRepository.findByName("github")).thenReturn(Optional.empty(), Optional.of(bot));
        when(agentRepository.saveAndFlush(any(Agent.class)))
                .thenThrow(new DataIntegrityViolationException("uq_agent_name"));
        when(postRepository.findByProjectIdAndTypeIn(eq(projectId), anyList())).thenReturn(List.of());
        Post created = Post.create(projectId, bot, "x", "", "github-issue", List.of(), Set.of());
        when(pipeline.runPostPipeline(any(), any(), any(), any(), any(), anyList())).thenReturn(created);

        var result = bridge.bridge(projectId, "issues", new GitHubEventPayload("opened",
                new Item(9, "Race", null, null), null, repo));

        assertThat(result.outcome()).isEqualTo(GitHubBridgeService.Outcome.CREATED);
        verify(pipeline).runPostPipeline(eq(new Actor(bot.getId(), "github")), eq(projectId),
                eq("[Issue #9] Race"), eq(""), eq("github-issue"), anyList());
        verify(transactionManager).rollback(any());
    }

    @Test
    @DisplayName("closing a bridged item closes its post through the status-change pipeline")
    void closes() {
        projectWithBot();
        Post bridged = Post.create(projectId, bot, "[Issue #7] x", "", "github-issue",
                List.of("github", "octocat/hello-world", "github:octocat/hello-world#7"), Set.of());
        when(postRepository.findByProjectIdAndTypeIn(eq(projectId), anyList())).thenReturn(List.of(bridged));

        var result = bridge.bridge(projectId, "issues",
                new GitHubEventPayload("closed", new Item(7, "x", null, null), null, repo));

        assertThat(result.outcome()).isEqualTo(GitHubBridgeService.Outcome.CLOSED);
        assertThat(bridged.getStatus()).isEqualTo("closed");
        verify(pipeline).runStatusChangePipeline(bridged, "open", "closed", new Actor(bot.getId(), "github"));
        verify(pipeline, never()).runPostPipeline(any(), any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("reopening a bridged item reopens the post instead of duplicating it")
    void reopens() {
        projectWithBot();
        Post bridged = Post.create(projectId, bot, "[Issue #7] x", "", "github-issue",
                List.of("github:octocat/hello-world#7"), Set.of());
        bridged.changeStatus("closed");
        when(postRepository.findByProjectIdAndTypeIn(eq(projectId), anyList())).thenReturn(List.of(bridged));

        var result = bridge.bridge(projectId, "issues",
                new GitHubEventPayload("reopened", new Item(7, "x", null, null), null, repo));

        assertThat(result.outcome()).isEqualTo(GitHubBridgeService.Outcome.REOPENED);
        assertThat(bridged.getStatus()).isEqualTo("open");
    }

    @Test
    @DisplayName("closing an item that was never bridged is ignored")
    void closeUnknown() {
        projectWithBot();
        when(postRepository.findByProjectIdAndTypeIn(eq(projectId), anyList())).thenReturn(List.of());

        var result = bridge.bridge(projectId, "issues",
                new GitHubEventPayload("closed", new Item(9, "x", null, null), null, repo));

        assertThat(result.outcome()).isEqualTo(GitHubBridgeService.Outcome.IGNORED);
        verifyNoInteractions(pipeline);
    }

    @Test
    @DisplayName("unknown projects are rejected before anything else")
    void unknownProject() {
        when(projectRepository.existsById(projectId)).thenReturn(false);

        assertThatThrownBy(() -> bridge.bridge(projectId, "issues",
                new GitHubEventPayload("opened", new Item(1, "x", null, null), null, repo)))
                .isInstanceOf(NotFoundException.class);
        verifyNoInteractions(agentRepository, pipeline);
    }
}
