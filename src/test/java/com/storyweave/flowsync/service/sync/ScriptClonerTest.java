package com.storyweave.flowsync.service.sync;

import com.storyweave.flowsync.model.script.*;
import org.junit.jupiter.api.Test;

import static com.storyweave.flowsync.ScriptFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class ScriptClonerTest {

    private final ScriptCloner cloner = new ScriptCloner();

    @Test
    void cloneScript_isEqualButSharesNoMutableState() {
        Script script = menuScript();
        script.getStatements().add(label("label-misc", "misc",
                set("set-1", "points", "0"),
                call("call-1", "left"),
                ifNode("if-1", branch("points > 0", dialogue("dlg-if", null, "yes")))));

        Script copy = cloner.cloneScript(script);

        assertThat(copy).isEqualTo(script);
        assertThat(copy.getMetadata()).isEqualTo(script.getMetadata()).isNotSameAs(script.getMetadata());

        MenuNode copiedMenu = (MenuNode) ((LabelNode) copy.getStatements().get(0)).getBody().get(4);
        copiedMenu.getChoices().get(1).getBody().clear();
        ((LabelNode) copy.getStatements().get(1)).setName("renamed");

        MenuNode originalMenu = (MenuNode) ((LabelNode) script.getStatements().get(0)).getBody().get(4);
        assertThat(originalMenu.getChoices().get(1).getBody()).hasSize(1);
        assertThat(((LabelNode) script.getStatements().get(1)).getName()).isEqualTo("left");
    }

    @Test
    void clone_keepsTrivia() {
        DialogueNode dialogue = dialogue("dlg-1", "eileen", "Hello");
        dialogue.setLine(12);
        dialogue.setRaw("    e \"Hello\"");

        ScriptNode copy = cloner.clone(dialogue);

        assertThat(copy).isEqualTo(dialogue).isNotSameAs(dialogue);
        assertThat(copy.getLine()).isEqualTo(12);
    }

    @Test
    void shallowCopy_emptiesChildBodies_butKeepsOwnFields() {
        MenuNode menu = menu("menu-1", "Where?", choice("Left", jump("j", "left")), choice("Right"));

        MenuNode copy = (MenuNode) cloner.shallowCopy(menu);

        assertThat(copy.getPrompt()).isEqualTo("Where?");
        assertThat(copy.getChoices()).extracting(MenuChoice::getText).containsExactly("Left", "Right");
        assertThat(copy.getChoices()).allSatisfy(choice -> assertThat(choice.getBody()).isEmpty());
        assertThat(menu.getChoices().get(0).getBody()).hasSize(1);
    }

    @Test
    void nullInputs_giveNull() {
        assertThat(cloner.cloneScript(null)).isNull();
        assertThat(cloner.clone(null)).isNull();
        assertThat(cloner.cloneAll(null)).isEmpty();
    }
}
