package org.rostilos.prwizard.pipelineagent;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.rostilos.prwizard.core.model.annotation.CommentLocation;
import org.rostilos.prwizard.core.model.annotation.OwnerRepo;
import org.rostilos.prwizard.core.persistence.repository.annotation.PendingAnnotationRepository;
import org.rostilos.prwizard.core.service.annotation.PendingAnnotationStore;
import org.rostilos.prwizard.pipelineagent.generic.annotation.AnnotationCommentClient;
import org.rostilos.prwizard.pipelineagent.generic.annotation.AnnotationRegistry;
import org.rostilos.prwizard.pipelineagent.generic.annotation.ExpirySweeper;
import org.rostilos.prwizard.pipelineagent.generic.annotation.ReconciliationEngine;
import org.rostilos.prwizard.pipelineagent.generic.annotation.Resolution;
import org.rostilos.prwizard.pipelineagent.generic.annotation.SweepReport;
import org.rostilos.prwizard.pipelineagent.generic.command.ParsedCommand;
import org.rostilos.prwizard.pipelineagent.support.CommentEvents;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Registry, engine and sweeper wired together against the JPA store on H2.
 */
@SpringBootTest
@ActiveProfiles("test")
class AnnotationLifecycleIntegrationTest {

    private static final OwnerRepo REPO = new OwnerRepo(CommentEvents.OWNER, CommentEvents.REPO);

    @MockBean
    private AnnotationCommentClient commentClient;

    @Autowired
    private AnnotationRegistry registry;

    @Autowired
    private ReconciliationEngine engine;

    @Autowired
    private ExpirySweeper sweeper;

    @Autowired
    private PendingAnnotationStore store;

    @Autowired
    private PendingAnnotationRepository repository;

    @AfterEach
    void tearDown() {
        repository.deleteAll();
    }

    @Test
    void sweeperIsNotStartedWhenDisabled() {
        assertThat(sweeper.isRunning()).isFalse();
    }

    @Test
    void acceptedAnnotationIsResolvedOnce() {
        when(commentClient.deleteComment(anyLong(), any(), any())).thenReturn(true);
        String code = registry.registerAnnotation(CommentLocation.inline(555L), REPO, 42,
                CommentEvents.INSTALLATION_ID, 120);

        Resolution first = engine.handleCommand(ParsedCommand.accept(code), CommentEvents.issueComment(901L, "/accept " + code));
        Resolution second = engine.handleCommand(ParsedCommand.reject(code), CommentEvents.issueComment(902L, "/reject " + code));

        assertThat(first).isEqualTo(Resolution.ACCEPTED);
        assertThat(second).isEqualTo(Resolution.NOT_FOUND);
        assertThat(store.get(code)).isEmpty();
        verify(commentClient).deleteComment(CommentEvents.INSTALLATION_ID, REPO, CommentLocation.thread(901L));
    }

    @Test
    void lapsedAnnotationIsSweptAndItsCommentDeleted() {
        when(commentClient.deleteComment(anyLong(), any(), any())).thenReturn(true);
        String lapsed = registry.registerAnnotation(CommentLocation.thread(700L), REPO, 42,
                CommentEvents.INSTALLATION_ID, 0);
        String live = registry.registerAnnotation(CommentLocation.thread(701L), REPO, 42,
                CommentEvents.INSTALLATION_ID, 3_600);

        SweepReport report = sweeper.sweep();

        assertThat(report.expired()).isEqualTo(1);
        assertThat(store.get(lapsed)).isEmpty();
        assertThat(store.get(live)).isPresent();
        verify(commentClient).deleteComment(CommentEvents.INSTALLATION_ID, REPO, CommentLocation.thread(700L));
    }
}
