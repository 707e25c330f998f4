package com.storyweave.flowsync.service.sync;

import com.storyweave.flowsync.model.script.*;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * The one traversal of nested script bodies.
 *
 * Nesting is described by {@link #childBodies(ScriptNode)}: a label owns its body, a menu owns one body
 * per choice, a conditional one body per branch. Lookup, id collection, removal, trivia restoration and
 * merging all go through the methods here, so a new nestable kind only needs to be taught to that accessor.
 */
@Component
public class ScriptTreeWalker {

    private static final ScriptNodeVisitor<List<List<ScriptNode>>> CHILD_BODIES = new ChildBodiesVisitor();

    /**
     * Child bodies of a statement, in order. Empty for statements that do not nest.
     */
    public List<List<ScriptNode>> childBodies(ScriptNode node) {
        return node.accept(CHILD_BODIES);
    }

    // ========================= TRAVERSAL =========================

    public void forEach(Script script, Consumer<ScriptNode> action) {
        forEach(script.getStatements(), action);
    }

    /**
     * Pre-order visit of every statement in the given bodies and below.
     */
    public void forEach(List<ScriptNode> body, Consumer<ScriptNode> action) {
        for (ScriptNode node : body) {
            action.accept(node);
            for (List<ScriptNode> child : childBodies(node)) {
                forEach(child, action);
            }
        }
    }

    /**
     * Pre-order visit passing each statement with its owner (null at top level).
     */
    public void forEachWithOwner(Script script, BiConsumer<ScriptNode, ScriptNode> action) {
        forEachWithOwner(script.getStatements(), null, action);
    }

    private void forEachWithOwner(List<ScriptNode> body, ScriptNode owner, BiConsumer<ScriptNode, ScriptNode> action) {
        for (ScriptNode node : body) {
            action.accept(node, owner);
            for (List<ScriptNode> child : childBodies(node)) {
                forEachWithOwner(child, node, action);
            }
        }
    }

    public List<String> preorderIds(Script script) {
        List<String> ids = new ArrayList<>();
        forEach(script, node -> ids.add(node.getId()));
        return ids;
    }

    public Set<String> collectIds(Script script) {
        return new LinkedHashSet<>(preorderIds(script));
    }

    public Set<String> collectIds(ScriptNode root) {
        Set<String> ids = new LinkedHashSet<>();
        forEach(List.of(root), node -> ids.add(node.getId()));
        return ids;
    }

    public Map<String, ScriptNode> indexById(Script script) {
        Map<String, ScriptNode> index = new LinkedHashMap<>();
        forEach(script, node -> index.putIfAbsent(node.getId(), node));
        return index;
    }

    /**
     * Map of statement id to the id of its owning statement. Top-level statements are absent.
     */
    public Map<String, String> ownerIndex(Script script) {
        Map<String, String> owners = new HashMap<>();
        forEachWithOwner(script, (node, owner) -> {
            if (owner != null) {
                owners.put(node.getId(), owner.getId());
            }
        });
        return owners;
    }

    // ========================= LOOKUP =========================

    public Optional<ScriptNode> findById(Script script, String id) {
        return findById(script.getStatements(), id);
    }

    public Optional<ScriptNode> findById(List<ScriptNode> body, String id) {
        if (id == null) return Optional.empty();
        for (ScriptNode node : body) {
            if (id.equals(node.getId())) {
                return Optional.of(node);
            }
            for (List<ScriptNode> child : childBodies(node)) {
                Optional<ScriptNode> found = findById(child, id);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    public Optional<NodeLocation> locate(Script script, String id) {
        return locate(script.getStatements(), null, 0, id);
    }

    private Optional<NodeLocation> locate(List<ScriptNode> body, String ownerId, int bodyIndex, String id) {
        if (id == null) return Optional.empty();
        for (int i = 0; i < body.size(); i++) {
            ScriptNode node = body.get(i);
            if (id.equals(node.getId())) {
                return Optional.of(new NodeLocation(ownerId, bodyIndex, i, body));
            }
            List<List<ScriptNode>> children = childBodies(node);
            for (int b = 0; b < children.size(); b++) {
                Optional<NodeLocation> found = locate(children.get(b), node.getId(), b, id);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    // ========================= MUTATION =========================

    /**
     * Removes every statement matching the predicate from the bodies and all nested bodies.
     * Matching statements are not descended into.
     *
     * @return ids of the removed statements
     */
    public List<String> removeMatching(List<ScriptNode> body, Predicate<ScriptNode> predicate) {
        List<String> removed = new ArrayList<>();
        Iterator<ScriptNode> it = body.iterator();
        while (it.hasNext()) {
            ScriptNode node = it.next();
            if (predicate.test(node)) {
                removed.add(node.getId());
                it.remove();
                continue;
            }
            for (List<ScriptNode> child : childBodies(node)) {
                removed.addAll(removeMatching(child, predicate));
            }
        }
        return removed;
    }

    /**
     * Removes the first statement, in pre-order, matching the predicate.
     */
    public boolean removeFirst(List<ScriptNode> body, Predicate<ScriptNode> predicate) {
        for (int i = 0; i < body.size(); i++) {
            ScriptNode node = body.get(i);
            if (predicate.test(node)) {
                body.remove(i);
                return true;
            }
            for (List<ScriptNode> child : childBodies(node)) {
                if (removeFirst(child, predicate)) {
                    return true;
                }
            }
        }
        return false;
    }

    public boolean removeById(Script script, String id) {
        return id != null && removeFirst(script.getStatements(), node -> id.equals(node.getId()));
    }

    /**
     * Inserts right after the statement with the given id, wherever it is nested.
     */
    public boolean insertAfter(List<ScriptNode> body, String afterId, ScriptNode newNode) {
        for (int i = 0; i < body.size(); i++) {
            ScriptNode node = body.get(i);
            if (node.getId() != null && node.getId().equals(afterId)) {
                body.add(i + 1, newNode);
                return true;
            }
            for (List<ScriptNode> child : childBodies(node)) {
                if (insertAfter(child, afterId, newNode)) {
                    return true;
                }
            }
        }
        return false;
    }

    public boolean replace(Script script, String id, ScriptNode replacement) {
        Optional<NodeLocation> location = locate(script, id);
        location.ifPresent(loc -> loc.body().set(loc.index(), replacement));
        return location.isPresent();
    }

    private static final class ChildBodiesVisitor implements ScriptNodeVisitor<List<List<ScriptNode>>> {

        @Override
        public List<List<ScriptNode>> visitLabel(LabelNode node) {
            return List.of(node.getBody());
        }

        @Override
        public List<List<ScriptNode>> visitMenu(MenuNode node) {
            return node.getChoices().stream().map(MenuChoice::getBody).toList();
        }

        @Override
        public List<List<ScriptNode>> visitIf(IfNode node) {
            return node.getBranches().stream().map(IfBranch::getBody).toList();
        }

        @Override
        public List<List<ScriptNode>> visitDialogue(DialogueNode node) {
            return List.of();
        }

        @Override
        public List<List<ScriptNode>> visitJump(JumpNode node) {
            return List.of();
        }

        @Override
        public List<List<ScriptNode>> visitCall(CallNode node) {
            return List.of();
        }

        @Override
        public List<List<ScriptNode>> visitReturn(ReturnNode node) {
            return List.of();
        }

        @Override
        public List<List<ScriptNode>> visitScene(SceneNode node) {
            return List.of();
        }

        @Override
        public List<List<ScriptNode>> visitShow(ShowNode node) {
            return List.of();
        }

        @Override
        public List<List<ScriptNode>> visitHide(HideNode node) {
            return List.of();
        }

        @Override
        public List<List<ScriptNode>> visitWith(WithNode node) {
            return List.of();
        }

        @Override
        public List<List<ScriptNode>> visitSet(SetNode node) {
            return List.of();
        }

        @Override
        public List<List<ScriptNode>> visitPython(PythonNode node) {
            return List.of();
        }

        @Override
        public List<List<ScriptNode>> visitPause(PauseNode node) {
            return List.of();
        }

        @Override
        public List<List<ScriptNode>> visitRaw(RawNode node) {
            return List.of();
        }
    }
}
