package com.repurpose.analysis.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.repurpose.analysis.model.CaseInsights.IngredientProfile;
import com.repurpose.analysis.model.ReferenceRecord;
import com.repurpose.analysis.service.reference.MedicineRow;
import jakarta.validation.constraints.Size;

import java.util.List;

public class AnalysisDtos {
    /** Hard cap; {@code app.max-input-length} may lower it further. */
    public static final int MAX_INPUT_LENGTH = 200;

    public static class AnalyzeRequestBody {
        @Size(max = MAX_INPUT_LENGTH)
        @JsonProperty("drug_name")
        @JsonAlias({"drugName", "drug"})
        private String drugName;
        @Size(max = MAX_INPUT_LENGTH)
        @JsonProperty("target_condition")
        @JsonAlias({"targetCondition", "condition"})
        private String targetCondition;
        @JsonProperty("analyze_ingredients")
        @JsonAlias({"analyzeIngredients"})
        private Boolean analyzeIngredients;

        public String getDrugName() { return drugName; }
        public void setDrugName(String drugName) { this.drugName = drugName; }
        public String getTargetCondition() { return targetCondition; }
        public void setTargetCondition(String targetCondition) { this.targetCondition = targetCondition; }
        public Boolean getAnalyzeIngredients() { return analyzeIngredients; }
        public void setAnalyzeIngredients(Boolean analyzeIngredients) { this.analyzeIngredients = analyzeIngredients; }

        public boolean ingredientMode() { return Boolean.TRUE.equals(analyzeIngredients); }
    }

    public static class SuggestionsResponseBody {
        private String query;
        private List<String> suggestions;

        public SuggestionsResponseBody() {}

        public SuggestionsResponseBody(String query, List<String> suggestions) {
            this.query = query;
            this.suggestions = suggestions;
        }

        public String getQuery() { return query; }
        public void setQuery(String query) { this.query = query; }
        public List<String> getSuggestions() { return suggestions; }
        public void setSuggestions(List<String> suggestions) { this.suggestions = suggestions; }
    }

    public static class MedicineSearchResponseBody {
        private boolean found;
        private ReferenceRecord medicine;

        public MedicineSearchResponseBody() {}

        public MedicineSearchResponseBody(boolean found, ReferenceRecord medicine) {
            this.found = found;
            this.medicine = medicine;
        }

        public boolean isFound() { return found; }
        public void setFound(boolean found) { this.found = found; }
        public ReferenceRecord getMedicine() { return medicine; }
        public void setMedicine(ReferenceRecord medicine) { this.medicine = medicine; }
    }

    public static class MedicinesByConditionResponseBody {
        private String condition;
        private List<MedicineRow> medicines;
        private int count;

        public MedicinesByConditionResponseBody() {}

        public MedicinesByConditionResponseBody(String condition, List<MedicineRow> medicines) {
            this.condition = condition;
            this.medicines = medicines;
            this.count = medicines.size();
        }

        public String getCondition() { return condition; }
        public void setCondition(String condition) { this.condition = condition; }
        public List<MedicineRow> getMedicines() { return medicines; }
        public void setMedicines(List<MedicineRow> medicines) { this.medicines = medicines; }
        public int getCount() { return count; }
        public void setCount(int count) { this.count = count; }
    }

    /** Reference record plus the class-level mechanism profile of its primary category. */
    public static class MedicineDetails {
        private ReferenceRecord medicine;
        private boolean marketedApproved;
        private IngredientProfile ingredientProfile;

        public MedicineDetails() {}

        public MedicineDetails(ReferenceRecord medicine, IngredientProfile ingredientProfile) {
            this.medicine = medicine;
            this.marketedApproved = medicine.marketedApproved();
            this.ingredientProfile = ingredientProfile;
        }

        public ReferenceRecord getMedicine() { return medicine; }
        public void setMedicine(ReferenceRecord medicine) { this.medicine = medicine; }
        public boolean isMarketedApproved() { return marketedApproved; }
        public void setMarketedApproved(boolean marketedApproved) { this.marketedApproved = marketedApproved; }
        public IngredientProfile getIngredientProfile() { return ingredientProfile; }
        public void setIngredientProfile(IngredientProfile ingredientProfile) { this.ingredientProfile = ingredientProfile; }
    }

    public static class MedicineDetailsResponseBody {
        private boolean found;
        private MedicineDetails details;

        public MedicineDetailsResponseBody() {}

        public MedicineDetailsResponseBody(boolean found, MedicineDetails details) {
            this.found = found;
            this.details = details;
        }

        public boolean isFound() { return found; }
        public void setFound(boolean found) { this.found = found; }
        public MedicineDetails getDetails() { return details; }
        public void setDetails(MedicineDetails details) { this.details = details; }
    }
}
