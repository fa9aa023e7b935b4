package org.javai.eg.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Owns every entity of one editing session, keyed by id.
 *
 * <p>Contexts refer to their children by id only. The registry keeps an explicit
 * child-to-parent index alongside the child sets, so parent lookup does not have to
 * scan every context. All changes to a child set must go through {@link #attach} and
 * {@link #detach}.</p>
 *
 * <p>Not thread-safe: callers serialize all mutation.</p>
 */
public class EntityRegistry {

	private final Map<String, GraphObject> objects = new LinkedHashMap<>();
	private final Map<String, String> parents = new HashMap<>();
	private final SheetOfAssertion sheet = new SheetOfAssertion();

	public EntityRegistry() {
		objects.put(sheet.id(), sheet);
	}

	public SheetOfAssertion sheet() {
		return sheet;
	}

	/**
	 * Registers a new entity.
	 *
	 * @throws DuplicateIdException if an entity with the same id is already registered
	 */
	public void add(GraphObject obj) {
		if (objects.containsKey(obj.id())) {
			throw new DuplicateIdException(obj.id());
		}
		objects.put(obj.id(), obj);
	}

	public Optional<GraphObject> get(String id) {
		return id == null ? Optional.empty() : Optional.ofNullable(objects.get(id));
	}

	public <T extends GraphObject> Optional<T> get(String id, Class<T> type) {
		return get(id).filter(type::isInstance).map(type::cast);
	}

	public boolean contains(String id) {
		return id != null && objects.containsKey(id);
	}

	/**
	 * Removes an entity and its back-reference in its parent context.
	 * Unknown ids are ignored.
	 */
	public void remove(String id) {
		if (id == null || SheetOfAssertion.ID.equals(id) || !objects.containsKey(id)) {
			return;
		}
		String parentId = parents.get(id);
		if (parentId != null) {
			detach(parentId, id);
		}
		objects.remove(id);
	}

	/**
	 * Places {@code childId} in the child set of {@code contextId}, moving it out of its
	 * previous parent if it had one.
	 */
	public void attach(String contextId, String childId) {
		Context context = get(contextId, Context.class)
				.orElseThrow(() -> new StructuralException("Parent context not found or invalid: " + contextId));
		if (!objects.containsKey(childId)) {
			throw new StructuralException("Cannot attach unknown object " + childId);
		}
		if (SheetOfAssertion.ID.equals(childId)) {
			throw new StructuralException("The sheet of assertion cannot have a parent");
		}
		String previous = parents.get(childId);
		if (previous != null && !previous.equals(contextId)) {
			detach(previous, childId);
		}
		context.addChild(childId);
		parents.put(childId, contextId);
	}

	public void detach(String contextId, String childId) {
		get(contextId, Context.class).ifPresent(context -> context.removeChild(childId));
		parents.remove(childId, contextId);
	}

	/**
	 * @return the id of the context holding {@code id}, empty for the sheet and unknown ids
	 */
	public Optional<String> parentOf(String id) {
		return id == null ? Optional.empty() : Optional.ofNullable(parents.get(id));
	}

	public Collection<GraphObject> objects() {
		return Collections.unmodifiableCollection(objects.values());
	}

	public <T extends GraphObject> List<T> objectsOf(Class<T> type) {
		return objects.values().stream()
				.filter(type::isInstance)
				.map(type::cast)
				.collect(Collectors.toList());
	}

	public int size() {
		return objects.size();
	}

	/**
	 * Lists every reference held by a registered entity that points at an id no longer
	 * registered. An empty list means the registry is consistent.
	 */
	public List<String> danglingReferences() {
		List<String> problems = new ArrayList<>();
		for (GraphObject obj : objects.values()) {
			if (obj instanceof Context context) {
				for (String child : context.children()) {
					if (!objects.containsKey(child)) {
						problems.add("context " + context.id() + " lists missing child " + child);
					}
				}
			} else if (obj instanceof Predicate predicate) {
				predicate.hooks().forEach((hook, lineId) -> {
					if (lineId != null && !(objects.get(lineId) instanceof LineOfIdentity)) {
						problems.add("predicate " + predicate.id() + " hook " + hook + " bound to missing line " + lineId);
					}
				});
			} else if (obj instanceof LineOfIdentity line) {
				for (String ligatureId : line.ligatures()) {
					if (!(objects.get(ligatureId) instanceof Ligature)) {
						problems.add("line " + line.id() + " lists missing ligature " + ligatureId);
					}
				}
			} else if (obj instanceof Ligature ligature) {
				if (!(objects.get(ligature.lineId()) instanceof LineOfIdentity)) {
					problems.add("ligature " + ligature.id() + " linked to missing line " + ligature.lineId());
				}
				for (HookRef attachment : ligature.attachments()) {
					if (!(objects.get(attachment.predicateId()) instanceof Predicate)) {
						problems.add("ligature " + ligature.id() + " attaches missing predicate " + attachment.predicateId());
					}
				}
			}
		}
		parents.forEach((child, parent) -> {
			if (!objects.containsKey(parent)) {
				problems.add("object " + child + " has missing parent " + parent);
			}
		});
		return problems;
	}
}
