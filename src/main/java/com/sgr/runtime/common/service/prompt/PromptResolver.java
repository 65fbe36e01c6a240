package com.sgr.runtime.common.service.prompt;

import com.sgr.runtime.common.RuntimeConfigException;
import com.sgr.runtime.common.RuntimeConfigException.Reason;
import com.sgr.runtime.common.StoreUnavailableException;
import com.sgr.runtime.common.config.RoleConfig;
import com.sgr.runtime.common.store.LiteLlmPromptStore;
import com.sgr.runtime.common.store.LocalPromptDirectory;
import com.sgr.runtime.common.store.LocalPromptDirectory.LocalPrompt;
import com.sgr.runtime.common.store.PromptStore;
import com.sgr.runtime.common.store.RegistryPromptStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves a role's instruction text through the ranked fallback chain:
 * inline text, then an identifier-keyed prompt store, then logical-name
 * stores, then the local prompt directory.
 * <p>
 * A store that is unreachable is treated like a miss, with a degradation note.
 * Only running out of sources is an error.
 */
@Service
public class PromptResolver {

    private static final Logger log = LoggerFactory.getLogger(PromptResolver.class);

    private final PromptStore idStore;
    private final List<PromptStore> nameStores;
    private final LocalPromptDirectory localDirectory;

    @Autowired
    public PromptResolver(LiteLlmPromptStore liteLlmPromptStore,
            RegistryPromptStore registryPromptStore,
            LocalPromptDirectory localDirectory) {
        this(liteLlmPromptStore, List.of(liteLlmPromptStore, registryPromptStore), localDirectory);
    }

    public PromptResolver(PromptStore idStore, List<PromptStore> nameStores, LocalPromptDirectory localDirectory) {
        this.idStore = idStore;
        this.nameStores = List.copyOf(nameStores);
        this.localDirectory = localDirectory;
    }

    public PromptResolution resolve(RoleConfig role) {
        List<String> degradations = new ArrayList<>();

        if (StringUtils.hasText(role.promptInline())) {
            return new PromptResolution(substitute(role.promptInline(), role.metadata()), PromptSource.INLINE,
                    "inline", degradations);
        }

        if (StringUtils.hasText(role.externalPromptId())) {
            Optional<String> text = lookup(idStore, role.externalPromptId(), role.name(), degradations);
            if (text.isPresent()) {
                return finish(role, text.get(), PromptSource.EXTERNAL_PROMPT_ID, idStore.name(), degradations);
            }
        }

        if (StringUtils.hasText(role.promptRef())) {
            for (PromptStore store : nameStores) {
                Optional<String> text = lookup(store, role.promptRef(), role.name(), degradations);
                if (text.isPresent()) {
                    return finish(role, text.get(), PromptSource.PROMPT_REF, store.name(), degradations);
                }
            }
        }

        Optional<LocalPrompt> local = localDirectory.read(role.name());
        if (local.isPresent()) {
            return finish(role, local.get().text(), PromptSource.LOCAL_FILE, local.get().fileName(), degradations);
        }

        throw new RuntimeConfigException(Reason.INSTRUCTION_UNRESOLVED,
                "No instruction text found for role [" + role.name() + "]"
                        + (degradations.isEmpty() ? "" : "; skipped: " + String.join(", ", degradations)));
    }

    private Optional<String> lookup(PromptStore store, String key, String roleName, List<String> degradations) {
        try {
            return store.fetch(key).filter(StringUtils::hasText);
        } catch (StoreUnavailableException e) {
            log.warn("Prompt store [{}] unreachable for role [{}], key [{}]: {}", store.name(), roleName, key,
                    e.getMessage());
            degradations.add(store.name() + " unreachable for [" + key + "]");
            return Optional.empty();
        }
    }

    private PromptResolution finish(RoleConfig role, String text, PromptSource source, String origin,
            List<String> degradations) {
        log.info("Role [{}] instructions resolved from {} ({})", role.name(), source.value(), origin);
        return new PromptResolution(substitute(text, role.metadata()), source, origin, degradations);
    }

    /**
     * Replaces {@code {{key}}} placeholders with role metadata values.
     */
    static String substitute(String content, Map<String, Object> metadata) {
        if (content == null) {
            return "";
        }
        String processed = content;
        if (metadata != null) {
            for (Map.Entry<String, Object> entry : metadata.entrySet()) {
                String key = "{{" + entry.getKey() + "}}";
                processed = processed.replace(key, String.valueOf(entry.getValue()));
            }
        }
        return processed;
    }
}
