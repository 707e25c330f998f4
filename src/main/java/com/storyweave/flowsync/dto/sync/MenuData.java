package com.storyweave.flowsync.dto.sync;

import com.storyweave.flowsync.model.script.MenuChoice;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MenuData {
    private String prompt;

    @Builder.Default
    private List<MenuChoice> choices = new ArrayList<>();
}
