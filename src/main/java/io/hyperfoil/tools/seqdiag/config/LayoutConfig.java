package io.hyperfoil.tools.seqdiag.config;

import java.util.*;

/**
 * Sizes and spacings used by the layout engine, in pixels unless noted.
 * Instances are immutable, use {@link #with(Key, double)} to derive an adjusted copy.
 */
public class LayoutConfig {

    public enum Key {
        PARTICIPANT_GAP("participant-gap",160),
        BOX_WIDTH("box-width",120),
        BOX_HEIGHT("box-height",50),
        TOP_MARGIN("top-margin",20),
        TITLE_HEIGHT("title-height",30),
        PARTICIPANT_Y_OFFSET("participant-y-offset",10),
        MESSAGE_START_OFFSET("message-start-offset",30),
        ACTOR_EXTRA_OFFSET("actor-extra-offset",20),
        LIFELINE_TAIL("lifeline-tail",30),
        MIN_LIFELINE("min-lifeline",40),
        BOTTOM_MARGIN("bottom-margin",40),
        STEP_SPACING("step-spacing",35),
        BLOCK_HEADER_SPACE("block-header-space",30),
        BLOCK_AFTER_SPACE("block-after-space",15),
        SECTION_TOP_PAD("section-top-pad",35),
        SECTION_BOTTOM_PAD("section-bottom-pad",45),
        SECTION_BAND_HEIGHT("section-band-height",22),
        GROUP_PADDING_X("group-padding-x",15),
        GROUP_PADDING_TOP("group-padding-top",22),
        GROUP_PADDING_BOTTOM("group-padding-bottom",8),
        GROUP_LABEL_SIZE("group-label-size",11),
        FRAME_PADDING_X("frame-padding-x",30),
        FRAME_PADDING_TOP("frame-padding-top",42),
        FRAME_PADDING_BOTTOM("frame-padding-bottom",15),
        FRAME_LABEL_HEIGHT("frame-label-height",18),
        ACTIVATION_WIDTH("activation-width",10),
        ACTIVATION_NEST_OFFSET("activation-nest-offset",6),
        SELF_CALL_WIDTH("self-call-width",30),
        SELF_CALL_HEIGHT("self-call-height",25),
        NOTE_MAX_WIDTH("note-max-width",200),
        NOTE_PADDING("note-padding",8),
        NOTE_LINE_HEIGHT("note-line-height",16),
        NOTE_FOLD("note-fold",10),
        NOTE_CHAR_WIDTH("note-char-width",6.5),
        NOTE_GAP("note-gap",8),
        NOTE_OFFSET_X("note-offset-x",10),
        NOTE_OFFSET_Y("note-offset-y",10),
        COLLAPSED_NOTE_WIDTH("collapsed-note-width",30),
        COLLAPSED_NOTE_HEIGHT("collapsed-note-height",20);

        private static final Map<String,Key> BY_NAME = new HashMap<>();
        static {
            for(Key key : values()){
                BY_NAME.put(key.getName(),key);
            }
        }

        public static Key fromName(String name){
            return name == null ? null : BY_NAME.get(name.trim().toLowerCase(Locale.ROOT));
        }

        private final String name;
        private final double defaultValue;

        Key(String name, double defaultValue){
            this.name = name;
            this.defaultValue = defaultValue;
        }

        public String getName(){return name;}
        public double getDefaultValue(){return defaultValue;}
    }

    private static final LayoutConfig DEFAULTS = new LayoutConfig(new EnumMap<>(Key.class));

    public static LayoutConfig defaults(){return DEFAULTS;}

    private final EnumMap<Key,Double> values;

    private LayoutConfig(EnumMap<Key,Double> values){
        this.values = values;
    }

    public double get(Key key){
        Double value = values.get(key);
        return value == null ? key.getDefaultValue() : value;
    }

    public boolean isOverridden(Key key){
        return values.containsKey(key);
    }

    public LayoutConfig with(Key key, double value){
        if(Double.isNaN(value) || Double.isInfinite(value) || value < 0){
            throw new LayoutConfigException(key.getName()+" must be a finite number >= 0, got "+value);
        }
        EnumMap<Key,Double> copy = new EnumMap<>(Key.class);
        copy.putAll(values);
        copy.put(key,value);
        return new LayoutConfig(copy);
    }

    /**
     * @return every key with its effective value, keyed by the yaml name
     */
    public Map<String,Double> toMap(){
        Map<String,Double> rtrn = new LinkedHashMap<>();
        for(Key key : Key.values()){
            rtrn.put(key.getName(),get(key));
        }
        return rtrn;
    }

    public double getParticipantGap(){return get(Key.PARTICIPANT_GAP);}
    public double getBoxWidth(){return get(Key.BOX_WIDTH);}
    public double getBoxHeight(){return get(Key.BOX_HEIGHT);}
    public double getTopMargin(){return get(Key.TOP_MARGIN);}
    public double getTitleHeight(){return get(Key.TITLE_HEIGHT);}
    public double getParticipantYOffset(){return get(Key.PARTICIPANT_Y_OFFSET);}
    public double getMessageStartOffset(){return get(Key.MESSAGE_START_OFFSET);}
    public double getActorExtraOffset(){return get(Key.ACTOR_EXTRA_OFFSET);}
    public double getLifelineTail(){return get(Key.LIFELINE_TAIL);}
    public double getMinLifeline(){return get(Key.MIN_LIFELINE);}
    public double getBottomMargin(){return get(Key.BOTTOM_MARGIN);}
    public double getStepSpacing(){return get(Key.STEP_SPACING);}
    public double getBlockHeaderSpace(){return get(Key.BLOCK_HEADER_SPACE);}
    public double getBlockAfterSpace(){return get(Key.BLOCK_AFTER_SPACE);}
    public double getSectionTopPad(){return get(Key.SECTION_TOP_PAD);}
    public double getSectionBottomPad(){return get(Key.SECTION_BOTTOM_PAD);}
    public double getSectionBandHeight(){return get(Key.SECTION_BAND_HEIGHT);}
    public double getGroupPaddingX(){return get(Key.GROUP_PADDING_X);}
    public double getGroupPaddingTop(){return get(Key.GROUP_PADDING_TOP);}
    public double getGroupPaddingBottom(){return get(Key.GROUP_PADDING_BOTTOM);}
    public double getGroupLabelSize(){return get(Key.GROUP_LABEL_SIZE);}
    public double getFramePaddingX(){return get(Key.FRAME_PADDING_X);}
    public double getFramePaddingTop(){return get(Key.FRAME_PADDING_TOP);}
    public double getFramePaddingBottom(){return get(Key.FRAME_PADDING_BOTTOM);}
    public double getFrameLabelHeight(){return get(Key.FRAME_LABEL_HEIGHT);}
    public double getActivationWidth(){return get(Key.ACTIVATION_WIDTH);}
    public double getActivationNestOffset(){return get(Key.ACTIVATION_NEST_OFFSET);}
    public double getSelfCallWidth(){return get(Key.SELF_CALL_WIDTH);}
    public double getSelfCallHeight(){return get(Key.SELF_CALL_HEIGHT);}
    public double getNoteMaxWidth(){return get(Key.NOTE_MAX_WIDTH);}
    public double getNotePadding(){return get(Key.NOTE_PADDING);}
    public double getNoteLineHeight(){return get(Key.NOTE_LINE_HEIGHT);}
    public double getNoteFold(){return get(Key.NOTE_FOLD);}
    public double getNoteCharWidth(){return get(Key.NOTE_CHAR_WIDTH);}
    public double getNoteGap(){return get(Key.NOTE_GAP);}
    public double getNoteOffsetX(){return get(Key.NOTE_OFFSET_X);}
    public double getNoteOffsetY(){return get(Key.NOTE_OFFSET_Y);}
    public double getCollapsedNoteWidth(){return get(Key.COLLAPSED_NOTE_WIDTH);}
    public double getCollapsedNoteHeight(){return get(Key.COLLAPSED_NOTE_HEIGHT);}

    /**
     * @return how many characters fit on one wrapped note line, at least 1
     */
    public int getNoteMaxChars(){
        double charWidth = getNoteCharWidth();
        if(charWidth <= 0){
            return Integer.MAX_VALUE;
        }
        return Math.max(1,(int)Math.floor((getNoteMaxWidth() - 2 * getNotePadding()) / charWidth));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return toMap().equals(((LayoutConfig) o).toMap());
    }

    @Override
    public int hashCode() {
        return toMap().hashCode();
    }

    @Override
    public String toString(){
        return "LayoutConfig"+values;
    }
}
