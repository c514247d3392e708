package io.github.drompincen.restochat.runtime.tools;

import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.protocol.api.ToolDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.lang.reflect.Method;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Tool catalog. Tools are discovered through {@link ServiceLoader}; each public one-argument
 * {@code set*} method is wired with the matching Spring bean when one exists, so a tool whose
 * collaborator is missing stays registered and reports the problem when called.
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);
    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final ApplicationContext applicationContext;

    public ToolRegistry(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @PostConstruct
    public void loadTools() {
        int wired = 0;
        for (Tool tool : ServiceLoader.load(Tool.class)) {
            wired += wire(tool);
            register(tool);
        }
        log.info("Loaded {} tools via SPI ({} collaborators wired)", tools.size(), wired);
    }

    /** Adds a tool; a tool with the same name is replaced. */
    public void register(Tool tool) {
        Tool previous = tools.put(tool.name(), tool);
        if (previous != null && previous != tool) {
            log.info("Replaced tool {} ({} -> {})", tool.name(),
                    previous.getClass().getSimpleName(), tool.getClass().getSimpleName());
        } else {
            log.debug("Registered tool {} for {}", tool.name(), tool.visibility());
        }
    }

    public Optional<Tool> get(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Collection<Tool> all() {
        return Collections.unmodifiableCollection(tools.values());
    }

    /**
     * Registered tools that are both named in {@code whitelist} and visible to {@code persona},
     * sorted by name so prompts are stable.
     */
    public List<Tool> forPersona(Persona persona, Set<String> whitelist) {
        return tools.values().stream()
                .filter(t -> whitelist.contains(t.name()) && t.visibility().contains(persona))
                .sorted(Comparator.comparing(Tool::name))
                .collect(Collectors.toList());
    }

    public List<ToolDescriptor> descriptors() {
        return tools.values().stream()
                .sorted(Comparator.comparing(Tool::name))
                .map(ToolRegistry::describe)
                .collect(Collectors.toList());
    }

    public static ToolDescriptor describe(Tool tool) {
        return new ToolDescriptor(tool.name(), tool.description(), tool.inputSchema(), tool.visibility());
    }

    private int wire(Tool tool) {
        int wired = 0;
        for (Method setter : setters(tool)) {
            Class<?> type = setter.getParameterTypes()[0];
            String target = tool.name() + "." + setter.getName();
            Object bean;
            try {
                bean = applicationContext.getBean(type);
            } catch (BeansException e) {
                log.debug("No usable {} bean for {}: {}", type.getSimpleName(), target, e.getMessage());
                continue;
            }
            try {
                setter.invoke(tool, bean);
                wired++;
            } catch (ReflectiveOperationException e) {
                log.warn("Could not wire {} into {}: {}", type.getSimpleName(), target, e.getMessage());
            }
        }
        return wired;
    }

    private static List<Method> setters(Tool tool) {
        return Arrays.stream(tool.getClass().getMethods())
                .filter(m -> m.getName().startsWith("set") && m.getParameterCount() == 1)
                .collect(Collectors.toList());
    }
}
