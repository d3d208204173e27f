package io.b2mash.dashhub.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.dashhub.integration.IntegrationCredentials.ApiKeyCredentials;
import io.b2mash.dashhub.integration.auth.CredentialManager;
import io.b2mash.dashhub.integration.capability.CapabilityExecutionResult;
import io.b2mash.dashhub.integration.capability.CapabilityMethod;
import io.b2mash.dashhub.integration.capability.CapabilityRegistry;
import io.b2mash.dashhub.integration.capability.CapabilityRegistry.CatalogSummary;
import io.b2mash.dashhub.integration.error.IntegrationDisabledException;
import io.b2mash.dashhub.integration.error.IntegrationNotFoundException;
import io.b2mash.dashhub.integration.metric.MetricRequest;
import io.b2mash.dashhub.integration.metric.MetricResult;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IntegrationServiceTest {

  private static final IntegrationConfig ENABLED = config("git", true);
  private static final IntegrationConfig DISABLED = config("old-git", false);

  @Mock private IntegrationConfigStore configStore;
  @Mock private IntegrationRegistry integrationRegistry;
  @Mock private CapabilityRegistry capabilityRegistry;
  @Mock private CredentialManager credentialManager;

  private IntegrationService service;

  @BeforeEach
  void setUp() {
    service =
        new IntegrationService(
            configStore, integrationRegistry, capabilityRegistry, credentialManager);
  }

  @Nested
  class Lookup {

    @Test
    void unknownInstance_throwsNotFound() {
      when(configStore.findById("missing")).thenReturn(Optional.empty());

      assertThatThrownBy(() -> service.getData(new MetricRequest("missing", "overview", null)))
          .isInstanceOf(IntegrationNotFoundException.class)
          .hasMessageContaining("missing");
    }

    @Test
    void disabledInstance_rejectsMetricFetch() {
      when(configStore.findById("old-git")).thenReturn(Optional.of(DISABLED));

      assertThatThrownBy(() -> service.getData(new MetricRequest("old-git", "overview", null)))
          .isInstanceOf(IntegrationDisabledException.class);
      verifyNoInteractions(integrationRegistry);
    }

    @Test
    void disabledInstance_canStillBeTested() {
      var adapter = new StubAdapter("gitea");
      when(configStore.findById("old-git")).thenReturn(Optional.of(DISABLED));
      when(integrationRegistry.resolve("gitea")).thenReturn(adapter);

      var result = service.testConnection("old-git");

      assertThat(result.success()).isTrue();
    }

    @Test
    void listInstances_flagsTypesWithoutAdapter() {
      var orphan =
          new IntegrationConfig(
              "media", "sonarr", "Media", "nas", null, true, null, true, null, null);
      when(integrationRegistry.availableTypes()).thenReturn(List.of("gitea"));
      when(configStore.findAll()).thenReturn(List.of(ENABLED, orphan));

      var instances = service.listInstances();

      assertThat(instances)
          .extracting(IntegrationInstanceDto::id, IntegrationInstanceDto::adapterAvailable)
          .containsExactly(tuple("git", true), tuple("media", false));
      assertThat(instances.get(0).credentialType()).isEqualTo("ApiKeyCredentials");
    }
  }

  @Nested
  class Operations {

    @Test
    void getData_appliesRequestParamsAsOptionOverrides() {
      var adapter = mock(IntegrationAdapter.class);
      when(configStore.findById("git")).thenReturn(Optional.of(ENABLED));
      when(integrationRegistry.resolve("gitea")).thenReturn(adapter);
      when(adapter.getData(any(), eq("pull-requests")))
          .thenAnswer(
              invocation -> {
                IntegrationConfig effective = invocation.getArgument(0);
                return MetricResult.success(Map.of("limit", effective.option("repoLimit", "")));
              });

      var result =
          service.getData(new MetricRequest("git", "pull-requests", Map.of("repoLimit", "5")));

      assertThat(((MetricResult.Success) result).data()).containsEntry("limit", "5");
    }

    @Test
    void performAction_withoutActionSupport_isUnsuccessful() {
      when(configStore.findById("git")).thenReturn(Optional.of(ENABLED));
      when(integrationRegistry.resolveExtension("gitea", ActionPerformer.class))
          .thenReturn(Optional.empty());

      var result = service.performAction("git", "restart", Map.of());

      assertThat(result.success()).isFalse();
      assertThat(result.message()).isEqualTo("gitea does not support actions");
    }

    @Test
    void performAction_delegatesToPerformer() {
      when(configStore.findById("git")).thenReturn(Optional.of(ENABLED));
      when(integrationRegistry.resolveExtension("gitea", ActionPerformer.class))
          .thenReturn(Optional.of(new StubAdapter.Actionable("gitea")));

      var result = service.performAction("git", "restart", Map.of());

      assertThat(result.success()).isTrue();
      assertThat(result.message()).isEqualTo("Performed restart");
    }

    @Test
    void executeCapability_fillsInDuration() {
      var executor = mock(CapabilityExecutor.class);
      when(configStore.findById("git")).thenReturn(Optional.of(ENABLED));
      when(integrationRegistry.resolveExtension("gitea", CapabilityExecutor.class))
          .thenReturn(Optional.of(executor));
      when(executor.executeCapability(
              ENABLED, "repos-list", CapabilityMethod.GET, "/repos", Map.of()))
          .thenReturn(CapabilityExecutionResult.success(List.of(), 200));

      var result =
          service.executeCapability("git", "repos-list", CapabilityMethod.GET, "/repos", Map.of());

      assertThat(result.success()).isTrue();
      assertThat(result.statusCode()).isEqualTo(200);
      assertThat(result.durationMs()).isNotNull().isGreaterThanOrEqualTo(0L);
    }

    @Test
    void executeCapability_withoutExecutor_isUnsuccessful() {
      when(configStore.findById("git")).thenReturn(Optional.of(ENABLED));
      when(integrationRegistry.resolveExtension("gitea", CapabilityExecutor.class))
          .thenReturn(Optional.empty());

      var result =
          service.executeCapability("git", "repos-list", CapabilityMethod.GET, "/repos", Map.of());

      assertThat(result.success()).isFalse();
      assertThat(result.error()).contains("does not support capability execution");
    }

    @Test
    void listTypes_describesActionsAndCapabilitySupport() {
      when(integrationRegistry.adapters())
          .thenReturn(List.of(new StubAdapter.Actionable("pikvm")));
      when(capabilityRegistry.summary("pikvm"))
          .thenReturn(new CatalogSummary("pikvm", 4, 2, List.of("ATX")));

      var types = service.listTypes();

      assertThat(types).hasSize(1);
      var type = types.get(0);
      assertThat(type.metrics()).containsExactly("status");
      assertThat(type.actions()).containsExactly("restart");
      assertThat(type.supportsCapabilities()).isFalse();
      assertThat(type.capabilityCount()).isEqualTo(4);
      assertThat(type.implementedCapabilityCount()).isEqualTo(2);
    }
  }

  @Nested
  class Credentials {

    @Test
    void invalidateCredentials_dropsEntryForInstance() {
      when(configStore.findById("git")).thenReturn(Optional.of(ENABLED));

      service.invalidateCredentials("git");

      verify(credentialManager).invalidate(ENABLED);
    }

    @Test
    void invalidateAllCredentials_reportsHowManyWereHeld() {
      when(credentialManager.cachedCredentials()).thenReturn(3L);

      assertThat(service.invalidateAllCredentials()).isEqualTo(3L);
      verify(credentialManager).invalidateAll();
    }
  }

  private static IntegrationConfig config(String id, boolean enabled) {
    return new IntegrationConfig(
        id,
        "gitea",
        "Git",
        "git.local",
        null,
        true,
        null,
        enabled,
        new ApiKeyCredentials("token"),
        null);
  }
}
