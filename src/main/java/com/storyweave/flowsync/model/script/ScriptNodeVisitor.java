package com.storyweave.flowsync.model.script;

/**
 * Exhaustive dispatch over the statement kinds of a script tree.
 * Adding a statement kind adds a method here, so every consumer must handle it.
 */
public interface ScriptNodeVisitor<R> {

    R visitLabel(LabelNode node);

    R visitDialogue(DialogueNode node);

    R visitMenu(MenuNode node);

    R visitIf(IfNode node);

    R visitJump(JumpNode node);

    R visitCall(CallNode node);

    R visitReturn(ReturnNode node);

    R visitScene(SceneNode node);

    R visitShow(ShowNode node);

    R visitHide(HideNode node);

    R visitWith(WithNode node);

    R visitSet(SetNode node);

    R visitPython(PythonNode node);

    R visitPause(PauseNode node);

    R visitRaw(RawNode node);
}
