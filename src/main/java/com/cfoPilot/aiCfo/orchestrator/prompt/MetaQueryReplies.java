package com.cfoPilot.aiCfo.orchestrator.prompt;

/**
 * Fixed answers for UI suggestion chips that are not financial questions.
 */
public class MetaQueryReplies {

    private MetaQueryReplies() {}

    public static String connectorsLive(long connectorCount) {
        return ("Great! You already have %d accounting system(s) connected. Your financial data is being synced "
                + "automatically. If you'd like to connect additional systems or need help with integration, "
                + "please visit the Integrations page.").formatted(connectorCount);
    }

    public static final String CONNECT_GUIDANCE = """
            To connect your accounting system, please:

            1. Navigate to the **Integrations** page in the sidebar
            2. Click **"Connect"** next to your accounting system (QuickBooks, Xero, etc.)
            3. Follow the authentication steps
            4. Once connected, I'll automatically sync your financial data and provide real-time insights

            Connecting your accounting system will enable:
            • Automatic transaction syncing
            • Real-time financial metrics
            • More accurate forecasts and recommendations
            • Seamless data updates without manual CSV imports""";

    public static final String SAMPLE_QUESTIONS = """
            I'm ready to help! Please ask me any financial question, such as:

            • **Cash & Runway**: "What's my current runway?" or "How long will my cash last?"
            • **Burn Rate**: "What's my monthly burn rate?" or "How can I reduce expenses?"
            • **Revenue**: "Forecast revenue of $80k growing 8% for 12 months"
            • **Planning**: "What if we cut expenses by 20%?"
            • **Fundraising**: "Should I raise funding now?"
            • **Strategy**: "How can I improve profitability?"

            Just type your question and I'll provide a detailed analysis with actionable recommendations.""";
}
